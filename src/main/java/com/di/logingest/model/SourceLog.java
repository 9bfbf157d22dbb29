package com.di.logingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of importing one {@link LoadRequest}. Exactly one per request, whether the
 * source succeeded or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceLog {

    private String  bucket;
    private String  objectName;
    private SourceDescriptor source;

    /** Raw records attempted, whatever their outcome. */
    private long    rowCount;

    private boolean success;
    private String  error;

    private Instant startedAt;
    private Instant finishedAt;
}
