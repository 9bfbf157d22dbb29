package com.di.logingest.exception;

/**
 * Configuration error: the source descriptor names a parser or compression this
 * service does not handle. Never retried.
 */
public class UnsupportedSourceException extends LogIngestException {

    public UnsupportedSourceException(String message) {
        super(message);
    }
}
