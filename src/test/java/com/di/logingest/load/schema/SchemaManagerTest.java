package com.di.logingest.load.schema;

import com.di.logingest.exception.InvalidPartitionException;
import com.di.logingest.infra.warehouse.InMemoryWarehouse;
import com.di.logingest.model.Destination;
import com.di.logingest.model.LogRecord;
import com.di.logingest.model.PartitionUnit;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.di.logingest.load.schema.SchemaInferrerTest.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaManager Tests")
class SchemaManagerTest {

    private InMemoryWarehouse warehouse;
    private SchemaManager manager;

    @BeforeEach
    void setUp() {
        warehouse = new InMemoryWarehouse();
        manager = new SchemaManager(warehouse, new SchemaInferrer());
    }

    private static List<String> names(FieldList fields) {
        return fields.stream().map(Field::getName).collect(Collectors.toList());
    }

    private static Schema existingSchema() {
        List<Field> fields = new ArrayList<>(SchemaInferrer.fixedFields());
        fields.add(Field.newBuilder(LogRecord.COL_DATA, LegacySQLTypeName.RECORD, FieldList.of(
                Field.of("old", LegacySQLTypeName.STRING),
                Field.of("count", LegacySQLTypeName.INTEGER))).build());
        return Schema.of(fields);
    }

    // ============================================================================
    // Create
    // ============================================================================

    @Test
    @DisplayName("Should create a missing table with the inferred schema")
    void testCreate() {
        Destination dst = Destination.of("ds", "t");
        Schema schema = manager.evolve(dst, List.of(record(Map.of("a", "x"))));

        InMemoryWarehouse.StoredTable table = warehouse.getTable("ds", "t").orElseThrow();
        assertEquals(schema, table.schema());
        assertNull(table.partition());
        assertTrue(warehouse.getUpdates().isEmpty());
    }

    @Test
    @DisplayName("Should create a partitioned table for a destination with a partition unit")
    void testCreatePartitioned() {
        manager.evolve(Destination.of("ds", "t", "hour"), List.of(record(Map.of("a", "x"))));
        assertEquals(PartitionUnit.HOUR, warehouse.getTable("ds", "t").orElseThrow().partition());
    }

    @Test
    @DisplayName("Should reject an unknown partition unit without touching the warehouse")
    void testInvalidPartition() {
        Destination dst = Destination.of("ds", "t", "week");
        assertThrows(InvalidPartitionException.class, () -> manager.evolve(dst, List.of(record(Map.of("a", "x")))));
        assertTrue(warehouse.getTable("ds", "t").isEmpty());
    }

    // ============================================================================
    // Evolve
    // ============================================================================

    @Test
    @DisplayName("Should not update a table that already has every field")
    void testNoUpdateWhenUpToDate() {
        warehouse.putTable("ds", "t", existingSchema(), null);

        Schema schema = manager.evolve(Destination.of("ds", "t"), List.of(record(Map.of("old", "v"))));

        assertEquals(existingSchema(), schema);
        assertTrue(warehouse.getUpdates().isEmpty());
    }

    @Test
    @DisplayName("Should append new fields and never drop or retype existing ones")
    void testAdditiveEvolution() {
        warehouse.putTable("ds", "t", existingSchema(), null);

        // count arrives as STRING, old is absent, fresh is new
        Schema schema = manager.evolve(Destination.of("ds", "t"),
                List.of(record(Map.of("count", "many", "fresh", true))));

        FieldList data = schema.getFields().get(LogRecord.COL_DATA).getSubFields();
        assertEquals(List.of("old", "count", "fresh"), names(data));
        assertEquals(LegacySQLTypeName.INTEGER, data.get("count").getType());
        assertEquals(LegacySQLTypeName.BOOLEAN, data.get("fresh").getType());
        assertEquals(List.of("ds.t"), warehouse.getUpdates());
        assertEquals(schema, warehouse.getTable("ds", "t").orElseThrow().schema());
    }

    @Test
    @DisplayName("Should append top-level columns missing from an existing table")
    void testAppendTopLevel() {
        warehouse.putTable("ds", "t", Schema.of(Field.of("ID", LegacySQLTypeName.STRING)), null);

        Schema schema = manager.evolve(Destination.of("ds", "t"), List.of(record(Map.of("a", 1))));

        assertEquals(List.of("ID", "Timestamp", "IngestedAt", "IngestID", "Data"), names(schema.getFields()));
    }

    @Test
    @DisplayName("Should pass the fetched etag to the update")
    void testEtagPassed() {
        warehouse.putTable("ds", "t", existingSchema(), null);
        String etagBefore = warehouse.getTable("ds", "t").orElseThrow().etag();

        manager.evolve(Destination.of("ds", "t"), List.of(record(Map.of("new", 1))));

        assertNotEquals(etagBefore, warehouse.getTable("ds", "t").orElseThrow().etag());
    }

    @Test
    @DisplayName("Should match existing columns case-insensitively")
    void testCaseInsensitive() {
        List<Field> fields = new ArrayList<>(SchemaInferrer.fixedFields());
        fields.add(Field.newBuilder("data", LegacySQLTypeName.RECORD, FieldList.of(
                Field.of("A", LegacySQLTypeName.STRING))).build());
        warehouse.putTable("ds", "t", Schema.of(fields), null);

        Schema schema = manager.evolve(Destination.of("ds", "t"), List.of(record(Map.of("a", "x"))));

        assertEquals(5, schema.getFields().size());
        assertTrue(warehouse.getUpdates().isEmpty());
    }

    // ============================================================================
    // JSON snapshot
    // ============================================================================

    @Test
    @DisplayName("Should render the schema as JSON in field order")
    void testSchemaJson() {
        Schema schema = Schema.of(
                Field.newBuilder("ID", LegacySQLTypeName.STRING).setMode(Field.Mode.REQUIRED).build(),
                Field.newBuilder("Data", LegacySQLTypeName.RECORD, FieldList.of(
                        Field.of("b", LegacySQLTypeName.BOOLEAN))).build());

        assertEquals("[{\"name\":\"ID\",\"type\":\"STRING\",\"mode\":\"REQUIRED\"},"
                        + "{\"name\":\"Data\",\"type\":\"RECORD\",\"mode\":\"NULLABLE\","
                        + "\"fields\":[{\"name\":\"b\",\"type\":\"BOOLEAN\",\"mode\":\"NULLABLE\"}]}]",
                new SchemaJson(new ObjectMapper()).toJson(schema));
    }
}
