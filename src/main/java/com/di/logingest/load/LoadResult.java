package com.di.logingest.load;

import com.di.logingest.model.IngestLog;
import com.di.logingest.model.SourceLog;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Summary of a successful load returned to callers.
 */
@Value
@Builder
public class LoadResult {

    /** {@code null} when there was nothing to load. */
    String runId;
    List<SourceLog> sources;
    List<IngestLog> ingests;

    public static LoadResult empty() {
        return new LoadResult(null, List.of(), List.of());
    }
}
