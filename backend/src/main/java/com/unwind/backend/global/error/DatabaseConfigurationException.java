package com.unwind.backend.global.error;

/**
 * Raised when the connection pool cannot be built from the configured settings.
 */
public class DatabaseConfigurationException extends IllegalStateException {

    public DatabaseConfigurationException(String message) {
        super(message);
    }
}
