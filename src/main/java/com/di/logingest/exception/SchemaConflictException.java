package com.di.logingest.exception;

/**
 * Observed values for one field have no common column type.
 */
public class SchemaConflictException extends LogIngestException {

    public SchemaConflictException(String message) {
        super(message);
    }
}
