package com.di.logingest.load;

import com.di.logingest.exception.LoadFailedException;
import com.di.logingest.model.RecordSet;
import com.di.logingest.model.SourceLog;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Fan-in of every source import of one run.
 */
@Value
public class ImportResult {

    /** Records of the successful sources, merged by destination. */
    RecordSet merged;

    /** One log per request, in completion order. */
    List<SourceLog> logs;

    List<LoadFailedException.Failure> failures;

    /** Present iff at least one source failed; lists every failure. */
    public Optional<LoadFailedException> error() {
        return failures.isEmpty() ? Optional.empty() : Optional.of(new LoadFailedException(failures));
    }
}
