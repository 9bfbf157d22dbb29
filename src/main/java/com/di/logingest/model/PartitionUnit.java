package com.di.logingest.model;

import com.di.logingest.exception.InvalidPartitionException;

import java.util.Locale;

/**
 * Time-bucketing granularity of a partitioned destination table.
 */
public enum PartitionUnit {
    HOUR("hour"),
    DAY("day"),
    MONTH("month"),
    YEAR("year");

    private final String value;

    PartitionUnit(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws InvalidPartitionException for anything other than hour, day, month or year
     */
    public static PartitionUnit of(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PartitionUnit unit : values()) {
                if (unit.value.equals(normalized)) {
                    return unit;
                }
            }
        }
        throw new InvalidPartitionException("Invalid time partition unit: '" + value + "'");
    }
}
