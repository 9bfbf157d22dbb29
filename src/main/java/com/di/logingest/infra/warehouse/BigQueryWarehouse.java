package com.di.logingest.infra.warehouse;

import com.di.logingest.exception.WarehouseException;
import com.di.logingest.model.LogRecord;
import com.di.logingest.model.PartitionUnit;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.TimePartitioning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Warehouse} backed by BigQuery. Rows go through the streaming insert API with the
 * record id as insert id, so replays of the same object are de-duplicated server side.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "logingest.warehouse.type", havingValue = "bigquery", matchIfMissing = true)
public class BigQueryWarehouse implements Warehouse {

    /** Canonical BigQuery timestamp literal, microsecond precision. */
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final int MAX_REPORTED_ERRORS = 5;

    private final BigQuery bigQuery;

    @Override
    public void insert(String dataset, String table, Schema schema, List<InsertRow> rows) {
        InsertAllRequest.Builder request = InsertAllRequest.newBuilder(TableId.of(dataset, table));
        for (InsertRow row : rows) {
            request.addRow(row.insertId(), toBigQueryMap(row.content()));
        }

        InsertAllResponse response;
        try {
            response = bigQuery.insertAll(request.build());
        } catch (BigQueryException e) {
            throw new WarehouseException("Insert into " + dataset + "." + table + " failed", e);
        }

        if (response.hasErrors()) {
            Map<Long, List<BigQueryError>> errors = response.getInsertErrors();
            List<String> samples = new ArrayList<>();
            for (Map.Entry<Long, List<BigQueryError>> e : errors.entrySet()) {
                if (samples.size() >= MAX_REPORTED_ERRORS) {
                    break;
                }
                samples.add("row " + e.getKey() + ": " + e.getValue());
            }
            throw new WarehouseException(String.format(
                    "Insert into %s.%s rejected %d of %d row(s): %s",
                    dataset, table, errors.size(), rows.size(), String.join("; ", samples)));
        }
        log.debug("[BQ] inserted {} row(s) into {}.{}", rows.size(), dataset, table);
    }

    @Override
    public Optional<TableMeta> getMetadata(String dataset, String table) {
        try {
            Table t = bigQuery.getTable(TableId.of(dataset, table));
            if (t == null || !t.exists()) {
                return Optional.empty();
            }
            return Optional.of(new TableMeta(t.getDefinition().getSchema(), t.getEtag()));
        } catch (BigQueryException e) {
            throw new WarehouseException("Failed to get metadata of " + dataset + "." + table, e);
        }
    }

    @Override
    public void createTable(String dataset, String table, Schema schema, PartitionUnit partition) {
        StandardTableDefinition.Builder definition = StandardTableDefinition.newBuilder().setSchema(schema);
        if (partition != null) {
            definition.setTimePartitioning(TimePartitioning.newBuilder(toPartitioningType(partition))
                    .setField(LogRecord.COL_TIMESTAMP)
                    .build());
        }
        try {
            bigQuery.create(TableInfo.of(TableId.of(dataset, table), definition.build()));
            log.info("[BQ] created table {}.{} (partition={})", dataset, table, partition);
        } catch (BigQueryException e) {
            throw new WarehouseException("Failed to create table " + dataset + "." + table, e);
        }
    }

    @Override
    public void updateTable(String dataset, String table, Schema schema, String etag) {
        try {
            Table current = bigQuery.getTable(TableId.of(dataset, table));
            if (current == null || !current.exists()) {
                throw new WarehouseException("Table " + dataset + "." + table + " disappeared before update");
            }
            if (etag != null && !etag.equals(current.getEtag())) {
                throw new WarehouseException(String.format(
                        "Table %s.%s was modified concurrently (etag %s, expected %s)",
                        dataset, table, current.getEtag(), etag));
            }
            StandardTableDefinition definition = current.getDefinition();
            current.toBuilder()
                    .setDefinition(definition.toBuilder().setSchema(schema).build())
                    .build()
                    .update();
            log.info("[BQ] updated schema of {}.{}", dataset, table);
        } catch (BigQueryException e) {
            throw new WarehouseException("Failed to update table " + dataset + "." + table, e);
        }
    }

    private static TimePartitioning.Type toPartitioningType(PartitionUnit unit) {
        switch (unit) {
            case HOUR:  return TimePartitioning.Type.HOUR;
            case DAY:   return TimePartitioning.Type.DAY;
            case MONTH: return TimePartitioning.Type.MONTH;
            case YEAR:  return TimePartitioning.Type.YEAR;
            default:    throw new IllegalArgumentException("Unhandled partition unit " + unit);
        }
    }

    /** Instants become timestamp literals; nested maps and lists are converted recursively. */
    static Map<String, Object> toBigQueryMap(Map<String, Object> content) {
        Map<String, Object> out = new LinkedHashMap<>();
        content.forEach((k, v) -> out.put(k, toBigQueryValue(v)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object toBigQueryValue(Object value) {
        if (value instanceof Instant) {
            return TIMESTAMP_FORMAT.format((Instant) value);
        }
        if (value instanceof Map) {
            return toBigQueryMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object v : (List<Object>) value) {
                out.add(toBigQueryValue(v));
            }
            return out;
        }
        return value;
    }
}
