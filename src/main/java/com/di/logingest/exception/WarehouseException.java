package com.di.logingest.exception;

/**
 * A warehouse call (metadata, create, update, insert) failed.
 */
public class WarehouseException extends LogIngestException {

    public WarehouseException(String message) {
        super(message);
    }

    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }
}
