package com.di.logingest.load.schema;

import com.di.logingest.infra.warehouse.TableMeta;
import com.di.logingest.infra.warehouse.Warehouse;
import com.di.logingest.model.Destination;
import com.di.logingest.model.LogRecord;
import com.di.logingest.model.PartitionUnit;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Makes sure a destination table can hold a batch of records.
 *
 * <p>Evolution is additive only: existing fields keep their type and mode, fields
 * present only in the inferred schema are appended. A missing table is created,
 * time-partitioned on {@code Timestamp} when the destination asks for it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    private final Warehouse      warehouse;
    private final SchemaInferrer inferrer;

    /**
     * @return the schema the table has after this call
     * @throws com.di.logingest.exception.InvalidPartitionException for an unknown partition unit
     * @throws com.di.logingest.exception.SchemaConflictException   if the records disagree on a field type
     */
    public Schema evolve(Destination destination, List<LogRecord> records) {
        return evolve(destination, inferrer.infer(records));
    }

    /**
     * Same as {@link #evolve(Destination, List)} for a schema known in advance.
     */
    public Schema evolve(Destination destination, Schema required) {
        PartitionUnit partition = destination.partitionUnit().orElse(null);
        String dataset = destination.getDataset();
        String table = destination.getTable();

        Optional<TableMeta> meta = warehouse.getMetadata(dataset, table);
        if (meta.isEmpty()) {
            warehouse.createTable(dataset, table, required, partition);
            log.info("[SCHEMA] created {} with {} column(s)", destination, required.getFields().size());
            return required;
        }

        Merge merged = merge(meta.get().schema().getFields(), required.getFields(), "");
        if (merged.appended == 0) {
            log.debug("[SCHEMA] {} is up to date", destination);
            return meta.get().schema();
        }

        Schema updated = Schema.of(merged.fields);
        warehouse.updateTable(dataset, table, updated, meta.get().etag());
        log.info("[SCHEMA] updated {}: {} field(s) appended", destination, merged.appended);
        return updated;
    }

    /**
     * Existing fields first, unchanged except for sub-fields appended to records; then
     * the inferred fields the table does not have yet, in inferred order.
     */
    static Merge merge(FieldList existing, FieldList inferred, String path) {
        List<Field> out = new ArrayList<>();
        int appended = 0;

        for (Field current : existing) {
            Field candidate = find(inferred, current.getName());
            if (candidate == null) {
                out.add(current);
                continue;
            }
            if (LegacySQLTypeName.RECORD.equals(current.getType()) && LegacySQLTypeName.RECORD.equals(candidate.getType())) {
                Merge sub = merge(current.getSubFields(), candidate.getSubFields(), path + current.getName() + ".");
                if (sub.appended > 0) {
                    out.add(current.toBuilder().setType(LegacySQLTypeName.RECORD, FieldList.of(sub.fields)).build());
                    appended += sub.appended;
                    continue;
                }
            } else if (!current.getType().equals(candidate.getType())) {
                log.warn("[SCHEMA] keeping {}{} as {}, records carry {}",
                         path, current.getName(), current.getType(), candidate.getType());
            }
            out.add(current);
        }

        for (Field candidate : inferred) {
            if (find(existing, candidate.getName()) == null) {
                out.add(candidate);
                appended++;
            }
        }
        return new Merge(out, appended);
    }

    /** Column names are case-insensitive in the warehouse. */
    private static Field find(FieldList fields, String name) {
        if (fields == null) {
            return null;
        }
        for (Field f : fields) {
            if (f.getName().equalsIgnoreCase(name)) {
                return f;
            }
        }
        return null;
    }

    record Merge(List<Field> fields, int appended) {
    }
}
