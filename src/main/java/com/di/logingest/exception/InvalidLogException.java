package com.di.logingest.exception;

/**
 * A structured log emitted by the schema policy failed validation. The whole source
 * that produced it is discarded.
 */
public class InvalidLogException extends LogIngestException {

    public InvalidLogException(String message) {
        super(message);
    }
}
