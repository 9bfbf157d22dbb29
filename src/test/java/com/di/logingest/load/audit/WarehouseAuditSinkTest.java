package com.di.logingest.load.audit;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.infra.warehouse.InMemoryWarehouse;
import com.di.logingest.load.schema.SchemaInferrer;
import com.di.logingest.load.schema.SchemaManager;
import com.di.logingest.model.IngestLog;
import com.di.logingest.model.LoadLog;
import com.di.logingest.model.SourceDescriptor;
import com.di.logingest.model.SourceLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WarehouseAuditSink Tests")
class WarehouseAuditSinkTest {

    private InMemoryWarehouse warehouse;
    private LogIngestProperties properties;

    @BeforeEach
    void setUp() {
        warehouse = new InMemoryWarehouse();
        properties = new LogIngestProperties();
        properties.getAudit().setEnabled(true);
        properties.getAudit().setDataset("meta");
        properties.getAudit().setTable("load_logs");
    }

    private WarehouseAuditSink sink() {
        return new WarehouseAuditSink(warehouse, new SchemaManager(warehouse, new SchemaInferrer()), properties);
    }

    private static LoadLog loadLog() {
        LoadLog log = LoadLog.builder()
                .id("run-1")
                .startedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .finishedAt(Instant.parse("2024-01-01T00:00:05Z"))
                .success(false)
                .error("Load failed")
                .build();
        log.getSources().add(SourceLog.builder()
                .bucket("b").objectName("o.json")
                .source(SourceDescriptor.builder().parser("json").schema("cloudtrail").build())
                .rowCount(4).success(true).build());
        log.getIngests().add(IngestLog.builder()
                .id("ing-1").dataset("aws").table("cloudtrail").logCount(4).chunkCount(1).success(true).build());
        return log;
    }

    @Test
    @DisplayName("Should create the audit table and insert one row keyed by run id")
    @SuppressWarnings("unchecked")
    void testWrite() {
        sink().write(loadLog());

        assertTrue(warehouse.getTable("meta", "load_logs").isPresent());
        assertEquals(1, warehouse.getInserted().size());
        InMemoryWarehouse.Inserted inserted = warehouse.getInserted().get(0);
        assertEquals("run-1", inserted.rows().get(0).insertId());

        Map<String, Object> row = inserted.rows().get(0).content();
        assertEquals(false, row.get("Success"));
        assertEquals("Load failed", row.get("Error"));
        List<Map<String, Object>> sources = (List<Map<String, Object>>) row.get("Sources");
        assertEquals("cloudtrail", sources.get(0).get("Schema"));
        assertEquals(4L, sources.get(0).get("RowCount"));
        assertFalse(sources.get(0).containsKey("Compress"));
        List<Map<String, Object>> ingests = (List<Map<String, Object>>) row.get("Ingests");
        assertEquals("aws", ingests.get(0).get("Dataset"));
    }

    @Test
    @DisplayName("Should reuse the audit table on later runs without updating it")
    void testSecondWrite() {
        WarehouseAuditSink sink = sink();
        sink.write(loadLog());
        sink.write(loadLog());

        assertEquals(2, warehouse.getInserted().size());
        assertTrue(warehouse.getUpdates().isEmpty());
    }

    @Test
    @DisplayName("Should require the audit dataset and table")
    void testMissingDestination() {
        properties.getAudit().setTable(" ");
        assertThrows(IllegalStateException.class, this::sink);
    }
}
