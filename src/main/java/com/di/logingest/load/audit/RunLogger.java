package com.di.logingest.load.audit;

import com.di.logingest.model.LoadLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Opens and closes the {@link LoadLog} of a run. The run id is put into the MDC as
 * {@code runId} between {@link #begin()} and {@link #finish(LoadLog)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunLogger {

    public static final String MDC_RUN_ID = "runId";

    private final AuditSink auditSink;
    private final Clock     clock;

    public LoadLog begin() {
        LoadLog loadLog = LoadLog.builder()
                .id(UUID.randomUUID().toString())
                .startedAt(clock.instant())
                .build();
        MDC.put(MDC_RUN_ID, loadLog.getId());
        log.info("[RUN] started {}", loadLog.getId());
        return loadLog;
    }

    /**
     * Completes the log and hands it to the audit sink. Never throws; call from a
     * {@code finally} block.
     */
    public void finish(LoadLog loadLog) {
        loadLog.setFinishedAt(clock.instant());
        try {
            log.info("[RUN] request handled: success={} sources={} ingests={} duration={}ms error={}",
                     loadLog.isSuccess(), loadLog.getSources().size(), loadLog.getIngests().size(),
                     Duration.between(loadLog.getStartedAt(), loadLog.getFinishedAt()).toMillis(),
                     loadLog.getError());
            try {
                auditSink.write(loadLog);
            } catch (RuntimeException e) {
                log.error("[AUDIT] failed to write load log {}: {}", loadLog.getId(), e.getMessage(), e);
            }
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }
}
