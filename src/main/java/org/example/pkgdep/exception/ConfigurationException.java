package org.example.pkgdep.exception;

import java.util.List;

/**
 * Exception thrown when configuration validation fails.
 */
public class ConfigurationException extends PkgDepException {

    private final List<String> validationErrors;

    public ConfigurationException(String message, List<String> validationErrors) {
        super(message);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
