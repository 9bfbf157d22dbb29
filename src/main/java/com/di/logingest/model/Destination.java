package com.di.logingest.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Warehouse table a group of records is loaded into. Pure value, used as a map key.
 *
 * <p>The partition unit is kept as the raw policy value; it is resolved when the
 * table is created so that an invalid unit only fails its own destination.
 */
@Value
@Builder
public class Destination {

    String dataset;
    String table;
    String partition;

    public static Destination of(String dataset, String table) {
        return new Destination(dataset, table, null);
    }

    public static Destination of(String dataset, String table, String partition) {
        return new Destination(dataset, table, partition);
    }

    public boolean isPartitioned() {
        return partition != null && !partition.isBlank();
    }

    public Optional<PartitionUnit> partitionUnit() {
        return isPartitioned() ? Optional.of(PartitionUnit.of(partition)) : Optional.empty();
    }

    @Override
    public String toString() {
        return dataset + "." + table + (isPartitioned() ? " (partition=" + partition + ")" : "");
    }
}
