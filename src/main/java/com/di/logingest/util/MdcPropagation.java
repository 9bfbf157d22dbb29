package com.di.logingest.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;

/**
 * Propagates SLF4J MDC (e.g. {@code runId} set by the run logger) to worker threads so
 * that logs written while importing sources in parallel carry the same correlation keys.
 * <p>
 * MDC is thread-local; without propagation, logs from an {@code ExecutorService} or
 * {@code CompletableFuture} do not contain the run's identifiers.
 * <p>
 * Usage: {@code CompletableFuture.runAsync(MdcPropagation.wrapRunnable(() -> work()), executor)}.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration
     * of the task and removes those keys in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
