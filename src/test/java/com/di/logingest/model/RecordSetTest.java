package com.di.logingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordSet Tests")
class RecordSetTest {

    private static final Destination A = Destination.of("ds", "a");
    private static final Destination B = Destination.of("ds", "b");

    private static LogRecord record(String id) {
        return LogRecord.builder().id(id).timestamp(Instant.EPOCH).ingestedAt(Instant.EPOCH).data(Map.of()).build();
    }

    private static List<String> ids(RecordSet set, Destination d) {
        return set.get(d).stream().map(LogRecord::getId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should append merged records after existing ones without de-duplication")
    void testMergeAppends() {
        RecordSet left = new RecordSet();
        left.add(A, record("1"));
        left.add(A, record("2"));
        RecordSet right = new RecordSet();
        right.add(A, record("2"));
        right.add(B, record("3"));

        left.merge(right);

        assertEquals(List.of("1", "2", "2"), ids(left, A));
        assertEquals(List.of("3"), ids(left, B));
        assertEquals(4, left.totalRecords());
    }

    @Test
    @DisplayName("Should keep destinations in first-seen order")
    void testDestinationOrder() {
        RecordSet set = new RecordSet();
        set.add(B, record("1"));
        set.add(A, record("2"));
        set.add(B, record("3"));
        assertEquals(List.of(B, A), List.copyOf(set.destinations()));
    }

    @Test
    @DisplayName("Should treat destinations with different partitions as different keys")
    void testPartitionIsPartOfKey() {
        RecordSet set = new RecordSet();
        set.add(new Destination("ds", "t", "day"), record("1"));
        set.add(new Destination("ds", "t", null), record("2"));
        assertEquals(2, set.size());
    }

    @Test
    @DisplayName("Should be a no-op to merge an empty or null set")
    void testMergeEmpty() {
        RecordSet set = new RecordSet();
        set.add(A, record("1"));
        set.merge(new RecordSet());
        set.merge(null);
        assertEquals(1, set.totalRecords());
        assertTrue(new RecordSet().isEmpty());
        assertTrue(set.get(B).isEmpty());
    }
}
