package com.di.logingest.load.audit;

import com.di.logingest.model.LoadLog;

/**
 * Persists the completed {@link LoadLog} of every run. When auditing is disabled, a
 * no-op implementation is used.
 */
public interface AuditSink {

    /**
     * Called once per run, after the log is complete. Failures are reported by the
     * caller and never fail the run.
     */
    void write(LoadLog loadLog);
}
