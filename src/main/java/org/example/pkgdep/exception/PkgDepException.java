package org.example.pkgdep.exception;

/**
 * Base exception for all package dependency explorer errors.
 */
public class PkgDepException extends Exception {

    public PkgDepException(String message) {
        super(message);
    }

    public PkgDepException(String message, Throwable cause) {
        super(message, cause);
    }
}
