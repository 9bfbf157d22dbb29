package com.di.logingest.load.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.Schema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of a table schema in the warehouse's own format
 * ({@code [{"name":…,"type":…,"mode":…,"fields":[…]}]}), field order preserved.
 */
@Component
@RequiredArgsConstructor
public class SchemaJson {

    private final ObjectMapper objectMapper;

    public String toJson(Schema schema) {
        try {
            return objectMapper.writeValueAsString(describe(schema.getFields()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise schema", e);
        }
    }

    private static List<Map<String, Object>> describe(FieldList fields) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Field f : fields) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("name", f.getName());
            node.put("type", f.getType().name());
            node.put("mode", f.getMode() == null ? Field.Mode.NULLABLE.name() : f.getMode().name());
            if (f.getSubFields() != null && !f.getSubFields().isEmpty()) {
                node.put("fields", describe(f.getSubFields()));
            }
            out.add(node);
        }
        return out;
    }
}
