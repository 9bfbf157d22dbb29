package com.di.logingest.exception;

import com.di.logingest.model.IngestLog;

/**
 * Loading one destination failed. Carries the ingest log that was recorded up to the
 * failure; chunks inserted before it stay in the table.
 */
public class IngestFailedException extends LogIngestException {

    private final transient IngestLog ingestLog;

    public IngestFailedException(String message, IngestLog ingestLog, Throwable cause) {
        super(message, cause);
        this.ingestLog = ingestLog;
    }

    public IngestLog getIngestLog() {
        return ingestLog;
    }
}
