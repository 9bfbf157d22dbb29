package com.di.logingest.infra.warehouse;

import java.util.Map;

/**
 * One row to insert; {@code insertId} doubles as the de-duplication key.
 */
public record InsertRow(String insertId, Map<String, Object> content) {
}
