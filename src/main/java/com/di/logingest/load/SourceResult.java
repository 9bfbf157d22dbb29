package com.di.logingest.load;

import com.di.logingest.model.RecordSet;
import com.di.logingest.model.SourceLog;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of one source import. On failure the record set is empty and
 * {@link #getError()} holds the cause.
 */
@Value
public class SourceResult {

    RecordSet records;
    SourceLog log;
    Throwable error;

    public static SourceResult success(RecordSet records, SourceLog log) {
        return new SourceResult(records, log, null);
    }

    public static SourceResult failure(SourceLog log, Throwable error) {
        return new SourceResult(new RecordSet(), log, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }
}
