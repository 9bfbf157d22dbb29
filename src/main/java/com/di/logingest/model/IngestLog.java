package com.di.logingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of loading one destination within a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestLog {

    /** Ingest id stamped on every inserted row. */
    private String  id;

    private String  dataset;
    private String  table;
    private long    logCount;
    private int     chunkCount;

    /** JSON snapshot of the schema used for the insert. */
    private String  tableSchema;

    private boolean success;
    private String  error;

    private Instant startedAt;
    private Instant finishedAt;
}
