package com.di.logingest.load.schema;

import com.di.logingest.exception.SchemaConflictException;
import com.di.logingest.model.LogRecord;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaInferrer Tests")
class SchemaInferrerTest {

    private SchemaInferrer inferrer;

    @BeforeEach
    void setUp() {
        inferrer = new SchemaInferrer();
    }

    static LogRecord record(Map<String, Object> data) {
        return LogRecord.builder()
                .id("id")
                .timestamp(Instant.EPOCH)
                .ingestedAt(Instant.EPOCH)
                .data(data)
                .build();
    }

    private static List<String> names(FieldList fields) {
        return fields.stream().map(Field::getName).collect(Collectors.toList());
    }

    private static Field dataField(Schema schema, String name) {
        return schema.getFields().get(LogRecord.COL_DATA).getSubFields().get(name);
    }

    @Test
    @DisplayName("Should put the fixed columns first and Data last")
    void testFixedColumns() {
        Schema schema = inferrer.infer(List.of(record(Map.of("a", "x"))));

        assertEquals(List.of("ID", "Timestamp", "IngestedAt", "IngestID", "Data"), names(schema.getFields()));
        assertEquals(LegacySQLTypeName.TIMESTAMP, schema.getFields().get("Timestamp").getType());
        assertEquals(LegacySQLTypeName.RECORD, schema.getFields().get("Data").getType());
    }

    @Test
    @DisplayName("Should map scalar values to column types")
    void testScalarTypes() {
        Schema schema = inferrer.infer(List.of(record(Map.of(
                "s", "text", "i", 7, "l", 7L, "f", 1.5, "b", true))));

        assertEquals(LegacySQLTypeName.STRING, dataField(schema, "s").getType());
        assertEquals(LegacySQLTypeName.INTEGER, dataField(schema, "i").getType());
        assertEquals(LegacySQLTypeName.INTEGER, dataField(schema, "l").getType());
        assertEquals(LegacySQLTypeName.FLOAT, dataField(schema, "f").getType());
        assertEquals(LegacySQLTypeName.BOOLEAN, dataField(schema, "b").getType());
    }

    @Test
    @DisplayName("Should sort Data sub-fields by name")
    void testSortedSubFields() {
        Schema schema = inferrer.infer(List.of(record(Map.of("zeta", 1, "alpha", 2, "mid", 3))));
        assertEquals(List.of("alpha", "mid", "zeta"),
                names(schema.getFields().get(LogRecord.COL_DATA).getSubFields()));
    }

    @Test
    @DisplayName("Should union fields across records and merge nested records")
    void testUnion() {
        Schema schema = inferrer.infer(List.of(
                record(Map.of("user", Map.of("name", "a"))),
                record(Map.of("user", Map.of("id", 1), "extra", "x"))));

        Field user = dataField(schema, "user");
        assertEquals(LegacySQLTypeName.RECORD, user.getType());
        assertEquals(List.of("id", "name"), names(user.getSubFields()));
        assertNotNull(dataField(schema, "extra"));
    }

    @Test
    @DisplayName("Should widen INTEGER and FLOAT to FLOAT")
    void testWidening() {
        Schema schema = inferrer.infer(List.of(record(Map.of("n", 1)), record(Map.of("n", 2.5))));
        assertEquals(LegacySQLTypeName.FLOAT, dataField(schema, "n").getType());
    }

    @Test
    @DisplayName("Should infer repeated fields from lists")
    void testRepeated() {
        Schema schema = inferrer.infer(List.of(record(Map.of(
                "tags", List.of("a", "b"),
                "items", List.of(Map.of("k", 1), Map.of("v", "x"))))));

        Field tags = dataField(schema, "tags");
        assertEquals(LegacySQLTypeName.STRING, tags.getType());
        assertEquals(Field.Mode.REPEATED, tags.getMode());

        Field items = dataField(schema, "items");
        assertEquals(LegacySQLTypeName.RECORD, items.getType());
        assertEquals(Field.Mode.REPEATED, items.getMode());
        assertEquals(List.of("k", "v"), names(items.getSubFields()));
    }

    @Test
    @DisplayName("Should omit empty lists and empty maps")
    void testOmitEmpty() {
        Schema schema = inferrer.infer(List.of(record(Map.of("empty", List.of(), "obj", Map.of(), "k", "v"))));
        assertEquals(List.of("k"), names(schema.getFields().get(LogRecord.COL_DATA).getSubFields()));
    }

    @Test
    @DisplayName("Should leave out Data when no value has a type")
    void testNoData() {
        Schema schema = inferrer.infer(List.of(record(Map.of())));
        assertEquals(List.of("ID", "Timestamp", "IngestedAt", "IngestID"), names(schema.getFields()));
    }

    @Test
    @DisplayName("Should reject incompatible types for the same field")
    void testConflict() {
        List<LogRecord> records = List.of(record(Map.of("x", "text")), record(Map.of("x", 1)));
        SchemaConflictException ex = assertThrows(SchemaConflictException.class, () -> inferrer.infer(records));
        assertTrue(ex.getMessage().contains("'Data.x'"));
    }

    @Test
    @DisplayName("Should reject a field that is both repeated and single")
    void testRepeatedConflict() {
        List<LogRecord> records = List.of(record(Map.of("x", "a")), record(Map.of("x", List.of("b"))));
        assertThrows(SchemaConflictException.class, () -> inferrer.infer(records));
    }

    @Test
    @DisplayName("Should reject nested arrays")
    void testNestedArray() {
        List<LogRecord> records = List.of(record(Map.of("m", List.of(List.of(1)))));
        assertThrows(SchemaConflictException.class, () -> inferrer.infer(records));
    }
}
