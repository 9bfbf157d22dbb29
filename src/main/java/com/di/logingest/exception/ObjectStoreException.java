package com.di.logingest.exception;

/**
 * A source object could not be opened, listed or described.
 */
public class ObjectStoreException extends LogIngestException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
