package com.di.logingest.model;

import com.di.logingest.exception.InvalidLogException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StructuredLog Tests")
class StructuredLogTest {

    private static StructuredLog.StructuredLogBuilder valid() {
        return StructuredLog.builder()
                .timestamp(1700000000.0)
                .dataset("aws_logs")
                .table("cloud-trail_1")
                .data(Map.of("k", "v"));
    }

    @Test
    @DisplayName("Should accept a well-formed log")
    void testValid() {
        assertDoesNotThrow(() -> valid().build().validate());
        assertDoesNotThrow(() -> valid().partition("day").build().validate());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "my-dataset", "data.set", "ds$"})
    @DisplayName("Should reject blank or malformed dataset names")
    void testInvalidDataset(String dataset) {
        assertThrows(InvalidLogException.class, () -> valid().dataset(dataset).build().validate());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a b", "t.t", "t/t"})
    @DisplayName("Should reject blank or malformed table names")
    void testInvalidTable(String table) {
        assertThrows(InvalidLogException.class, () -> valid().table(table).build().validate());
    }

    @Test
    @DisplayName("Should reject missing destination, timestamp or data")
    void testMissingFields() {
        assertThrows(InvalidLogException.class, () -> valid().dataset(null).build().validate());
        assertThrows(InvalidLogException.class, () -> valid().table(null).build().validate());
        assertThrows(InvalidLogException.class, () -> valid().timestamp(null).build().validate());
        assertThrows(InvalidLogException.class, () -> valid().data(null).build().validate());
    }

    @Test
    @DisplayName("Should reject non-finite timestamps")
    void testNonFiniteTimestamp() {
        assertThrows(InvalidLogException.class, () -> valid().timestamp(Double.NaN).build().validate());
        assertThrows(InvalidLogException.class, () -> valid().timestamp(Double.POSITIVE_INFINITY).build().validate());
    }

    @Test
    @DisplayName("Should expose its destination including the raw partition")
    void testDestination() {
        Destination d = valid().partition("month").build().getDestination();
        assertEquals(new Destination("aws_logs", "cloud-trail_1", "month"), d);
        assertEquals(PartitionUnit.MONTH, d.partitionUnit().orElseThrow());
    }
}
