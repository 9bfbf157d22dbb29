package com.di.logingest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Destination-keyed collection of records awaiting ingest.
 *
 * <p>Destinations keep first-seen order and records keep insertion order. Not thread
 * safe: every worker builds its own set and sets are merged on a single thread.
 */
public class RecordSet {

    private final Map<Destination, List<LogRecord>> records = new LinkedHashMap<>();

    public void add(Destination destination, LogRecord record) {
        records.computeIfAbsent(destination, d -> new ArrayList<>()).add(record);
    }

    /**
     * Appends every sequence of {@code other} after the records already held for the
     * same destination. No de-duplication happens here.
     */
    public void merge(RecordSet other) {
        if (other == null) {
            return;
        }
        other.records.forEach((dst, list) ->
                records.computeIfAbsent(dst, d -> new ArrayList<>()).addAll(list));
    }

    public Set<Destination> destinations() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public List<LogRecord> get(Destination destination) {
        List<LogRecord> list = records.get(destination);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public int totalRecords() {
        return records.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
