package com.di.logingest.load.audit;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.infra.warehouse.InsertRow;
import com.di.logingest.infra.warehouse.Warehouse;
import com.di.logingest.load.schema.SchemaManager;
import com.di.logingest.model.Destination;
import com.di.logingest.model.IngestLog;
import com.di.logingest.model.LoadLog;
import com.di.logingest.model.SourceLog;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one row per run into {@code logingest.audit.dataset}.{@code table}. The table
 * is created or extended through {@link SchemaManager} before each insert.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "logingest.audit.enabled", havingValue = "true")
public class WarehouseAuditSink implements AuditSink {

    static final Schema AUDIT_SCHEMA = Schema.of(
            nullable("ID", LegacySQLTypeName.STRING),
            nullable("StartedAt", LegacySQLTypeName.TIMESTAMP),
            nullable("FinishedAt", LegacySQLTypeName.TIMESTAMP),
            nullable("Success", LegacySQLTypeName.BOOLEAN),
            nullable("Error", LegacySQLTypeName.STRING),
            repeated("Sources",
                    nullable("Bucket", LegacySQLTypeName.STRING),
                    nullable("ObjectName", LegacySQLTypeName.STRING),
                    nullable("Parser", LegacySQLTypeName.STRING),
                    nullable("Schema", LegacySQLTypeName.STRING),
                    nullable("Compress", LegacySQLTypeName.STRING),
                    nullable("RowCount", LegacySQLTypeName.INTEGER),
                    nullable("Success", LegacySQLTypeName.BOOLEAN),
                    nullable("Error", LegacySQLTypeName.STRING),
                    nullable("StartedAt", LegacySQLTypeName.TIMESTAMP),
                    nullable("FinishedAt", LegacySQLTypeName.TIMESTAMP)),
            repeated("Ingests",
                    nullable("ID", LegacySQLTypeName.STRING),
                    nullable("Dataset", LegacySQLTypeName.STRING),
                    nullable("Table", LegacySQLTypeName.STRING),
                    nullable("LogCount", LegacySQLTypeName.INTEGER),
                    nullable("ChunkCount", LegacySQLTypeName.INTEGER),
                    nullable("TableSchema", LegacySQLTypeName.STRING),
                    nullable("Success", LegacySQLTypeName.BOOLEAN),
                    nullable("Error", LegacySQLTypeName.STRING),
                    nullable("StartedAt", LegacySQLTypeName.TIMESTAMP),
                    nullable("FinishedAt", LegacySQLTypeName.TIMESTAMP)));

    private final Warehouse     warehouse;
    private final SchemaManager schemaManager;
    private final Destination   destination;

    public WarehouseAuditSink(Warehouse warehouse, SchemaManager schemaManager, LogIngestProperties properties) {
        LogIngestProperties.Audit audit = properties.getAudit();
        if (isBlank(audit.getDataset()) || isBlank(audit.getTable())) {
            throw new IllegalStateException(
                    "logingest.audit.dataset and logingest.audit.table are required when auditing is enabled");
        }
        this.warehouse = warehouse;
        this.schemaManager = schemaManager;
        this.destination = Destination.of(audit.getDataset(), audit.getTable());
    }

    @Override
    public void write(LoadLog loadLog) {
        Schema schema = schemaManager.evolve(destination, AUDIT_SCHEMA);
        warehouse.insert(destination.getDataset(), destination.getTable(), schema,
                List.of(new InsertRow(loadLog.getId(), toRow(loadLog))));
        log.debug("[AUDIT] wrote load log {} to {}", loadLog.getId(), destination);
    }

    static Map<String, Object> toRow(LoadLog loadLog) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ID", loadLog.getId());
        row.put("StartedAt", loadLog.getStartedAt());
        row.put("FinishedAt", loadLog.getFinishedAt());
        row.put("Success", loadLog.isSuccess());
        putIfPresent(row, "Error", loadLog.getError());

        List<Map<String, Object>> sources = new ArrayList<>();
        for (SourceLog s : loadLog.getSources()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("Bucket", s.getBucket());
            m.put("ObjectName", s.getObjectName());
            if (s.getSource() != null) {
                putIfPresent(m, "Parser", s.getSource().getParser());
                putIfPresent(m, "Schema", s.getSource().getSchema());
                putIfPresent(m, "Compress", s.getSource().getCompress());
            }
            m.put("RowCount", s.getRowCount());
            m.put("Success", s.isSuccess());
            putIfPresent(m, "Error", s.getError());
            putIfPresent(m, "StartedAt", s.getStartedAt());
            putIfPresent(m, "FinishedAt", s.getFinishedAt());
            sources.add(m);
        }
        row.put("Sources", sources);

        List<Map<String, Object>> ingests = new ArrayList<>();
        for (IngestLog i : loadLog.getIngests()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("ID", i.getId());
            m.put("Dataset", i.getDataset());
            m.put("Table", i.getTable());
            m.put("LogCount", i.getLogCount());
            m.put("ChunkCount", i.getChunkCount());
            putIfPresent(m, "TableSchema", i.getTableSchema());
            m.put("Success", i.isSuccess());
            putIfPresent(m, "Error", i.getError());
            putIfPresent(m, "StartedAt", i.getStartedAt());
            putIfPresent(m, "FinishedAt", i.getFinishedAt());
            ingests.add(m);
        }
        row.put("Ingests", ingests);
        return row;
    }

    private static void putIfPresent(Map<String, Object> row, String key, Object value) {
        if (value != null) {
            row.put(key, value);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static Field nullable(String name, LegacySQLTypeName type) {
        return Field.newBuilder(name, type).setMode(Field.Mode.NULLABLE).build();
    }

    private static Field repeated(String name, Field... subFields) {
        return Field.newBuilder(name, LegacySQLTypeName.RECORD, FieldList.of(subFields))
                .setMode(Field.Mode.REPEATED)
                .build();
    }
}
