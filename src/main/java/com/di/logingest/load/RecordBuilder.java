package com.di.logingest.load;

import com.di.logingest.model.LogRecord;
import com.di.logingest.model.ObjectRef;
import com.di.logingest.model.StructuredLog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a validated {@link StructuredLog} into the {@link LogRecord} that is inserted.
 */
@Component
@RequiredArgsConstructor
public class RecordBuilder {

    private final Clock clock;

    /**
     * @param log         validated policy row
     * @param object      object the raw record was read from
     * @param outputIndex index of {@code log} within the policy output of its raw record
     */
    public LogRecord build(StructuredLog log, ObjectRef object, int outputIndex) {
        String id = log.getId() != null && !log.getId().isBlank()
                ? log.getId()
                : LogId.derive(object, outputIndex);

        return LogRecord.builder()
                .id(id)
                .timestamp(toInstant(log.getTimestamp()))
                .ingestedAt(clock.instant())
                .data(stripNulls(log.getData()))
                .build();
    }

    /**
     * Epoch seconds with fraction to an instant. Negative values go through the same
     * arithmetic, so -1.5 becomes -1s plus -0.5s.
     */
    static Instant toInstant(double epochSeconds) {
        long seconds = (long) epochSeconds;
        long nanos = Math.round((epochSeconds % 1.0) * 1e9);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    /**
     * Copy of {@code data} without null values at any depth. Null list elements are
     * dropped too, and so are maps and lists left empty, because no column can be
     * inferred for them.
     */
    static Map<String, Object> stripNulls(Map<String, Object> data) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            Object value = stripValue(e.getValue());
            if (value != null) {
                out.put(e.getKey(), value);
            }
        }
        return out;
    }

    /** @return the cleaned value, or {@code null} when nothing is left */
    @SuppressWarnings("unchecked")
    private static Object stripValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> map = stripNulls((Map<String, Object>) value);
            return map.isEmpty() ? null : map;
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object v : (List<Object>) value) {
                Object element = stripValue(v);
                if (element != null) {
                    out.add(element);
                }
            }
            return out.isEmpty() ? null : out;
        }
        return value;
    }
}
