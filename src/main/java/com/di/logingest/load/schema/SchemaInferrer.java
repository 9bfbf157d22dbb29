package com.di.logingest.load.schema;

import com.di.logingest.exception.SchemaConflictException;
import com.di.logingest.model.LogRecord;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Infers the table schema of a batch of records.
 *
 * <p>The fixed columns come first, then {@code Data} as a record whose sub-fields are
 * the union over every record's data map, sorted by name. Values without an inferable
 * type (empty list, empty map) contribute nothing.
 */
@Component
public class SchemaInferrer {

    /** Columns every log table has, in order. {@code Data} follows them. */
    public static List<Field> fixedFields() {
        return List.of(
                Field.newBuilder(LogRecord.COL_ID, LegacySQLTypeName.STRING).setMode(Field.Mode.REQUIRED).build(),
                Field.newBuilder(LogRecord.COL_TIMESTAMP, LegacySQLTypeName.TIMESTAMP).setMode(Field.Mode.REQUIRED).build(),
                Field.newBuilder(LogRecord.COL_INGESTED_AT, LegacySQLTypeName.TIMESTAMP).setMode(Field.Mode.REQUIRED).build(),
                Field.newBuilder(LogRecord.COL_INGEST_ID, LegacySQLTypeName.STRING).setMode(Field.Mode.NULLABLE).build());
    }

    /**
     * @throws SchemaConflictException when the same field carries incompatible types
     */
    public Schema infer(List<LogRecord> records) {
        Node data = Node.record();
        for (LogRecord r : records) {
            if (r.getData() != null) {
                data = merge(LogRecord.COL_DATA, data, inferMap(r.getData()));
            }
        }

        List<Field> fields = new ArrayList<>(fixedFields());
        if (!data.children.isEmpty()) {
            fields.add(toField(LogRecord.COL_DATA, data));
        }
        return Schema.of(fields);
    }

    // ---- inference ---------------------------------------------------------

    private Node inferMap(Map<String, Object> map) {
        Node node = Node.record();
        map.forEach((key, value) -> {
            Node child = inferValue(key, value);
            if (child != null) {
                node.children.merge(key, child, (a, b) -> merge(key, a, b));
            }
        });
        return node;
    }

    @SuppressWarnings("unchecked")
    private Node inferValue(String name, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map) {
            Node node = inferMap((Map<String, Object>) value);
            return node.children.isEmpty() ? null : node;
        }
        if (value instanceof List) {
            Node element = null;
            for (Object v : (List<Object>) value) {
                if (v instanceof List) {
                    throw new SchemaConflictException("Field '" + name + "': nested arrays are not supported");
                }
                Node n = inferValue(name, v);
                if (n != null) {
                    element = element == null ? n : merge(name, element, n);
                }
            }
            return element == null ? null : element.asRepeated();
        }
        return Node.scalar(scalarType(value));
    }

    private static LegacySQLTypeName scalarType(Object value) {
        if (value instanceof Boolean) {
            return LegacySQLTypeName.BOOLEAN;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return LegacySQLTypeName.INTEGER;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return LegacySQLTypeName.FLOAT;
        }
        if (value instanceof Instant) {
            return LegacySQLTypeName.TIMESTAMP;
        }
        return LegacySQLTypeName.STRING;
    }

    // ---- merge -------------------------------------------------------------

    private static Node merge(String name, Node a, Node b) {
        if (a.repeated != b.repeated) {
            throw new SchemaConflictException("Field '" + name + "' is both repeated and single");
        }
        if (a.type == LegacySQLTypeName.RECORD && b.type == LegacySQLTypeName.RECORD) {
            Node merged = Node.record();
            merged.repeated = a.repeated;
            merged.children.putAll(a.children);
            b.children.forEach((k, v) -> merged.children.merge(k, v, (x, y) -> merge(name + "." + k, x, y)));
            return merged;
        }
        if (a.type == b.type) {
            return a;
        }
        if (isNumeric(a.type) && isNumeric(b.type)) {
            Node widened = Node.scalar(LegacySQLTypeName.FLOAT);
            widened.repeated = a.repeated;
            return widened;
        }
        throw new SchemaConflictException(String.format(
                "Field '%s' has conflicting types %s and %s", name, a.type, b.type));
    }

    private static boolean isNumeric(LegacySQLTypeName type) {
        return type == LegacySQLTypeName.INTEGER || type == LegacySQLTypeName.FLOAT;
    }

    private static Field toField(String name, Node node) {
        Field.Builder builder;
        if (node.type == LegacySQLTypeName.RECORD) {
            List<Field> sub = new ArrayList<>();
            node.children.forEach((k, v) -> sub.add(toField(k, v)));
            builder = Field.newBuilder(name, LegacySQLTypeName.RECORD, FieldList.of(sub));
        } else {
            builder = Field.newBuilder(name, node.type);
        }
        return builder.setMode(node.repeated ? Field.Mode.REPEATED : Field.Mode.NULLABLE).build();
    }

    /** Inferred type of one field; children sorted by name. */
    private static final class Node {
        private final LegacySQLTypeName type;
        private final Map<String, Node> children = new TreeMap<>();
        private boolean repeated;

        private Node(LegacySQLTypeName type) {
            this.type = type;
        }

        static Node record() {
            return new Node(LegacySQLTypeName.RECORD);
        }

        static Node scalar(LegacySQLTypeName type) {
            return new Node(type);
        }

        Node asRepeated() {
            Node copy = new Node(type);
            copy.children.putAll(children);
            copy.repeated = true;
            return copy;
        }
    }
}
