package com.di.logingest.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for source imports, destination ingests and whole load runs.
 */
@Slf4j
@Component
public class MetricsCollector {

    // Source import
    private final Counter sourceSuccessCounter;
    private final Counter sourceErrorCounter;
    private final DistributionSummary sourceRowsDistribution;

    // Destination ingest
    private final Counter ingestSuccessCounter;
    private final Counter ingestErrorCounter;
    private final Counter ingestedRecordsCounter;
    private final Timer insertChunkTimer;

    // Load run
    private final Timer loadTimer;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.sourceSuccessCounter = Counter.builder("logingest.source.total")
                .description("Sources imported")
                .tag("status", "success")
                .register(meterRegistry);

        this.sourceErrorCounter = Counter.builder("logingest.source.total")
                .description("Sources that failed to import")
                .tag("status", "error")
                .register(meterRegistry);

        this.sourceRowsDistribution = DistributionSummary.builder("logingest.source.rows")
                .description("Raw records read per source")
                .baseUnit("rows")
                .register(meterRegistry);

        this.ingestSuccessCounter = Counter.builder("logingest.ingest.total")
                .description("Destinations loaded")
                .tag("status", "success")
                .register(meterRegistry);

        this.ingestErrorCounter = Counter.builder("logingest.ingest.total")
                .description("Destinations that failed to load")
                .tag("status", "error")
                .register(meterRegistry);

        this.ingestedRecordsCounter = Counter.builder("logingest.ingest.records")
                .description("Records inserted into the warehouse")
                .register(meterRegistry);

        this.insertChunkTimer = Timer.builder("logingest.ingest.chunk.duration")
                .description("Time taken by one warehouse insert call")
                .register(meterRegistry);

        this.loadTimer = Timer.builder("logingest.load.duration")
                .description("Time taken by one load invocation")
                .register(meterRegistry);
    }

    public void recordSource(boolean success, long rowCount) {
        (success ? sourceSuccessCounter : sourceErrorCounter).increment();
        sourceRowsDistribution.record(rowCount);
    }

    public void recordIngest(boolean success) {
        (success ? ingestSuccessCounter : ingestErrorCounter).increment();
    }

    /**
     * @param records    rows sent in the chunk
     * @param durationMs wall-clock time of the insert call
     */
    public void recordInsertChunk(int records, long durationMs) {
        ingestedRecordsCounter.increment(records);
        insertChunkTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded insert chunk: records={}, durationMs={}", records, durationMs);
    }

    public void recordLoad(long durationMs) {
        loadTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }
}
