package org.example.pkgdep.exception;

/**
 * Exception thrown when the package metadata provider cannot answer a query.
 */
public class ProviderUnavailableException extends PkgDepException {

    /**
     * Why the provider could not be used.
     */
    public enum Reason {
        NOT_FOUND,
        TIMEOUT,
        NON_ZERO_EXIT,
        EXECUTION_ERROR
    }

    private final Reason reason;

    public ProviderUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProviderUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
