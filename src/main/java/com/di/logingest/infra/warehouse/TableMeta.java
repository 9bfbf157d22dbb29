package com.di.logingest.infra.warehouse;

import com.google.cloud.bigquery.Schema;

/**
 * Current schema of a table together with the etag guarding updates.
 */
public record TableMeta(Schema schema, String etag) {
}
