package com.di.logingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit record of one load invocation. Created on entry, completed on exit and
 * persisted once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadLog {

    private String  id;

    @Builder.Default
    private List<SourceLog> sources = new ArrayList<>();

    @Builder.Default
    private List<IngestLog> ingests = new ArrayList<>();

    private boolean success;
    private String  error;

    private Instant startedAt;
    private Instant finishedAt;
}
