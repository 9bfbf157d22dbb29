package com.di.logingest.exception;

/**
 * Base type of every failure raised by the import-and-load pipeline.
 */
public class LogIngestException extends RuntimeException {

    public LogIngestException(String message) {
        super(message);
    }

    public LogIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
