package com.di.logingest.exception;

/**
 * Configuration error: a destination names a time partition unit other than hour,
 * day, month or year. Fatal for that destination only.
 */
public class InvalidPartitionException extends LogIngestException {

    public InvalidPartitionException(String message) {
        super(message);
    }
}
