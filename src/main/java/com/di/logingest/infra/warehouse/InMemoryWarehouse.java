package com.di.logingest.infra.warehouse;

import com.di.logingest.exception.WarehouseException;
import com.di.logingest.model.PartitionUnit;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Warehouse} that keeps tables and inserted rows in memory. Selected with
 * {@code logingest.warehouse.type=memory} for dry runs; also the test double.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "logingest.warehouse.type", havingValue = "memory")
public class InMemoryWarehouse implements Warehouse {

    private final Map<String, StoredTable> tables = new ConcurrentHashMap<>();
    private final List<Inserted> inserted = new ArrayList<>();
    private final List<String> updates = new ArrayList<>();

    @Override
    public synchronized void insert(String dataset, String table, Schema schema, List<InsertRow> rows) {
        StoredTable stored = tables.get(key(dataset, table));
        if (stored == null) {
            throw new WarehouseException("Table not found: " + key(dataset, table));
        }
        for (InsertRow row : rows) {
            checkColumns(stored.schema().getFields(), row.content(), "");
        }
        inserted.add(new Inserted(dataset, table, schema, List.copyOf(rows)));
        log.debug("[MEMORY] inserted {} row(s) into {}.{}", rows.size(), dataset, table);
    }

    @Override
    public Optional<TableMeta> getMetadata(String dataset, String table) {
        StoredTable t = tables.get(key(dataset, table));
        return t == null ? Optional.empty() : Optional.of(new TableMeta(t.schema(), t.etag()));
    }

    @Override
    public synchronized void createTable(String dataset, String table, Schema schema, PartitionUnit partition) {
        String key = key(dataset, table);
        if (tables.containsKey(key)) {
            throw new WarehouseException("Table already exists: " + key);
        }
        tables.put(key, new StoredTable(schema, partition, "etag-1", 1));
    }

    @Override
    public synchronized void updateTable(String dataset, String table, Schema schema, String etag) {
        String key = key(dataset, table);
        StoredTable current = tables.get(key);
        if (current == null) {
            throw new WarehouseException("Table not found: " + key);
        }
        if (etag != null && !etag.equals(current.etag())) {
            throw new WarehouseException("Table " + key + " was modified concurrently");
        }
        int version = current.version() + 1;
        tables.put(key, new StoredTable(schema, current.partition(), "etag-" + version, version));
        updates.add(key);
    }

    /** Pre-creates a table, e.g. to simulate an existing destination. */
    public void putTable(String dataset, String table, Schema schema, PartitionUnit partition) {
        tables.put(key(dataset, table), new StoredTable(schema, partition, "etag-1", 1));
    }

    public Optional<StoredTable> getTable(String dataset, String table) {
        return Optional.ofNullable(tables.get(key(dataset, table)));
    }

    public synchronized List<Inserted> getInserted() {
        return List.copyOf(inserted);
    }

    public synchronized List<String> getUpdates() {
        return List.copyOf(updates);
    }

    /** Rejects row keys without a matching column, like a real insertAll does. */
    @SuppressWarnings("unchecked")
    private static void checkColumns(FieldList fields, Map<String, Object> content, String path) {
        for (Map.Entry<String, Object> e : content.entrySet()) {
            Field field = find(fields, e.getKey());
            if (field == null) {
                throw new WarehouseException("no such field: " + path + e.getKey());
            }
            Object value = e.getValue();
            if (!LegacySQLTypeName.RECORD.equals(field.getType())) {
                continue;
            }
            String childPath = path + field.getName() + ".";
            if (value instanceof Map) {
                checkColumns(field.getSubFields(), (Map<String, Object>) value, childPath);
            } else if (value instanceof List) {
                for (Object element : (List<Object>) value) {
                    if (element instanceof Map) {
                        checkColumns(field.getSubFields(), (Map<String, Object>) element, childPath);
                    }
                }
            }
        }
    }

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

    private static String key(String dataset, String table) {
        return dataset + "." + table;
    }

    public record StoredTable(Schema schema, PartitionUnit partition, String etag, int version) {
    }

    public record Inserted(String dataset, String table, Schema schema, List<InsertRow> rows) {
    }
}
