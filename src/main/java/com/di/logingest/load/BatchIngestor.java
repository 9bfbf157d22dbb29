package com.di.logingest.load;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.exception.IngestFailedException;
import com.di.logingest.infra.warehouse.InsertRow;
import com.di.logingest.infra.warehouse.Warehouse;
import com.di.logingest.load.schema.SchemaJson;
import com.di.logingest.load.schema.SchemaManager;
import com.di.logingest.model.Destination;
import com.di.logingest.model.IngestLog;
import com.di.logingest.model.LogRecord;
import com.di.logingest.util.MetricsCollector;
import com.google.cloud.bigquery.Schema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Loads the records of one destination: evolve the table schema, then insert in
 * chunks of {@code logingest.ingest.chunk-size} rows.
 *
 * <p>The first failing chunk aborts the destination. Chunks inserted before it are not
 * rolled back; replaying the run relies on record ids for de-duplication.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchIngestor {

    private final SchemaManager       schemaManager;
    private final SchemaJson          schemaJson;
    private final Warehouse           warehouse;
    private final LogIngestProperties properties;
    private final MetricsCollector    metrics;
    private final Clock               clock;

    /**
     * @throws IngestFailedException carrying the ingest log when any step fails
     */
    public IngestLog ingest(Destination destination, List<LogRecord> records) {
        String ingestId = UUID.randomUUID().toString();
        IngestLog ingestLog = IngestLog.builder()
                .id(ingestId)
                .dataset(destination.getDataset())
                .table(destination.getTable())
                .logCount(records.size())
                .startedAt(clock.instant())
                .build();

        try {
            Schema schema = schemaManager.evolve(destination, records);
            ingestLog.setTableSchema(schemaJson.toJson(schema));

            int chunkSize = Math.max(1, properties.getIngest().getChunkSize());
            for (int from = 0; from < records.size(); from += chunkSize) {
                List<LogRecord> chunk = records.subList(from, Math.min(from + chunkSize, records.size()));
                insertChunk(destination, schema, chunk, ingestId);
                ingestLog.setChunkCount(ingestLog.getChunkCount() + 1);
            }

            ingestLog.setSuccess(true);
            log.info("[INGEST] {} records={} chunks={} ingestId={}",
                     destination, records.size(), ingestLog.getChunkCount(), ingestId);
            return ingestLog;

        } catch (RuntimeException e) {
            ingestLog.setSuccess(false);
            ingestLog.setError(e.getMessage());
            log.error("[INGEST] {} FAILED after {} chunk(s): {}",
                      destination, ingestLog.getChunkCount(), e.getMessage());
            throw new IngestFailedException("Ingest into " + destination + " failed", ingestLog, e);

        } finally {
            ingestLog.setFinishedAt(clock.instant());
            metrics.recordIngest(ingestLog.isSuccess());
        }
    }

    private void insertChunk(Destination destination, Schema schema, List<LogRecord> chunk, String ingestId) {
        List<InsertRow> rows = new ArrayList<>(chunk.size());
        for (LogRecord record : chunk) {
            LogRecord stamped = record.withIngestId(ingestId);
            rows.add(new InsertRow(stamped.getId(), stamped.toRow()));
        }
        long startMs = System.currentTimeMillis();
        warehouse.insert(destination.getDataset(), destination.getTable(), schema, rows);
        metrics.recordInsertChunk(rows.size(), System.currentTimeMillis() - startMs);
    }
}
