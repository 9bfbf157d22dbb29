package com.di.logingest.load;

import com.di.logingest.infra.policy.StubPolicyEvaluator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Policy rules used across load tests.
 */
final class TestPolicies {

    static final String CLOUDTRAIL_QUERY = "data.schema.cloudtrail";
    static final String CLOUDTRAIL_DATASET = "aws";
    static final String CLOUDTRAIL_TABLE = "cloudtrail";

    private TestPolicies() {
    }

    /** One log per entry of {@code Records}, id from {@code eventID}, partitioned by day. */
    @SuppressWarnings("unchecked")
    static Object cloudTrail(Object input) {
        Map<String, Object> raw = (Map<String, Object>) input;
        List<Map<String, Object>> logs = new ArrayList<>();
        for (Object r : (List<Object>) raw.getOrDefault("Records", List.of())) {
            Map<String, Object> record = (Map<String, Object>) r;
            Instant time = Instant.parse((String) record.get("eventTime"));
            Map<String, Object> log = new LinkedHashMap<>();
            log.put("id", record.get("eventID"));
            log.put("timestamp", time.getEpochSecond() + time.getNano() / 1e9);
            log.put("dataset", CLOUDTRAIL_DATASET);
            log.put("table", CLOUDTRAIL_TABLE);
            log.put("partition", "day");
            log.put("data", record);
            logs.add(log);
        }
        return Map.of("log", logs);
    }

    /** Emits the input as the data of a single log in {@code dataset.table}. */
    static Object passThrough(Object input, String dataset, String table) {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("timestamp", 1700000000.5);
        log.put("dataset", dataset);
        log.put("table", table);
        log.put("data", input);
        return Map.of("log", List.of(log));
    }

    static StubPolicyEvaluator cloudTrailPolicy() {
        return new StubPolicyEvaluator().rule(CLOUDTRAIL_QUERY, TestPolicies::cloudTrail);
    }
}
