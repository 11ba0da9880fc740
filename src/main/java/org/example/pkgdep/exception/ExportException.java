package org.example.pkgdep.exception;

/**
 * Exception thrown when a dependency graph cannot be written.
 */
public class ExportException extends PkgDepException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
