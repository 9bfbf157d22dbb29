package com.di.logingest.exception;

/**
 * The byte stream of a source object is not a valid sequence of JSON values, or the
 * stream broke while reading. Aborts that source only.
 */
public class ObjectDecodeException extends LogIngestException {

    public ObjectDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
