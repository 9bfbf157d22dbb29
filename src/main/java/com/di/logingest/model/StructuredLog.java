package com.di.logingest.model;

import com.di.logingest.exception.InvalidLogException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * One row emitted by the schema policy for a raw record, before it becomes a
 * {@link LogRecord}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructuredLog {

    private static final Pattern DATASET_PATTERN = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern TABLE_PATTERN   = Pattern.compile("[A-Za-z0-9_\\-]+");

    /** Optional; derived from the source object when blank. */
    private String id;

    /** Unix epoch seconds, fractional part carries the sub-second remainder. */
    private Double timestamp;

    private Map<String, Object> data;

    // ---- destination -------------------------------------------------------
    private String dataset;
    private String table;
    private String partition;

    @JsonIgnore
    public Destination getDestination() {
        return new Destination(dataset, table, partition);
    }

    /**
     * @throws InvalidLogException when the destination, timestamp or data is unusable
     */
    public void validate() {
        if (dataset == null || dataset.isBlank()) {
            throw new InvalidLogException("dataset is required");
        }
        if (!DATASET_PATTERN.matcher(dataset).matches()) {
            throw new InvalidLogException("invalid dataset name: '" + dataset + "'");
        }
        if (table == null || table.isBlank()) {
            throw new InvalidLogException("table is required");
        }
        if (!TABLE_PATTERN.matcher(table).matches()) {
            throw new InvalidLogException("invalid table name: '" + table + "'");
        }
        if (timestamp == null || timestamp.isNaN() || timestamp.isInfinite()) {
            throw new InvalidLogException("timestamp must be a finite number, got " + timestamp);
        }
        if (data == null) {
            throw new InvalidLogException("data is required");
        }
    }
}
