package com.di.logingest.load.audit;

import com.di.logingest.model.LoadLog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "logingest.audit.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpAuditSink implements AuditSink {

    @Override
    public void write(LoadLog loadLog) {
        // no-op when auditing is disabled
    }
}
