package com.di.logingest.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated, de-duplication-ready record waiting to be inserted.
 */
@Value
@Builder(toBuilder = true)
public class LogRecord {

    public static final String COL_ID          = "ID";
    public static final String COL_TIMESTAMP   = "Timestamp";
    public static final String COL_INGESTED_AT = "IngestedAt";
    public static final String COL_INGEST_ID   = "IngestID";
    public static final String COL_DATA        = "Data";

    String id;
    Instant timestamp;
    Instant ingestedAt;
    @With
    String ingestId;
    /** Never contains a null value, an empty map or an empty list at any depth. */
    Map<String, Object> data;

    /** Warehouse row in column order. {@code Data} is left out when empty. */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(COL_ID, id);
        row.put(COL_TIMESTAMP, timestamp);
        row.put(COL_INGESTED_AT, ingestedAt);
        row.put(COL_INGEST_ID, ingestId);
        if (data != null && !data.isEmpty()) {
            row.put(COL_DATA, data);
        }
        return row;
    }
}
