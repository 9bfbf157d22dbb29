package com.di.logingest.infra.warehouse;

import com.di.logingest.model.PartitionUnit;
import com.google.cloud.bigquery.Schema;

import java.util.List;
import java.util.Optional;

/**
 * Analytical warehouse the structured records are loaded into.
 *
 * <p>All methods throw {@link com.di.logingest.exception.WarehouseException} on failure.
 */
public interface Warehouse {

    /**
     * Inserts rows into an existing table. Each row carries an insert id used by the
     * warehouse for best-effort de-duplication.
     */
    void insert(String dataset, String table, Schema schema, List<InsertRow> rows);

    /** Schema and etag of the table, or empty when it does not exist. */
    Optional<TableMeta> getMetadata(String dataset, String table);

    /**
     * @param partition time partition unit on the {@code Timestamp} column, or {@code null}
     */
    void createTable(String dataset, String table, Schema schema, PartitionUnit partition);

    /**
     * Replaces the table schema, provided the table still has {@code etag}.
     */
    void updateTable(String dataset, String table, Schema schema, String etag);
}
