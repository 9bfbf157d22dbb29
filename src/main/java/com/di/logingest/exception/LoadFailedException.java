package com.di.logingest.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated failure of a load invocation. Enumerates every failing source and
 * destination; each one is also attached as a suppressed exception.
 */
public class LoadFailedException extends LogIngestException {

    private final transient List<Failure> failures;

    public LoadFailedException(List<Failure> failures) {
        super(format(failures));
        this.failures = List.copyOf(failures);
        for (Failure f : this.failures) {
            if (f.cause() != null) {
                addSuppressed(f.cause());
            }
        }
    }

    public List<Failure> getFailures() {
        return failures;
    }

    private static String format(List<Failure> failures) {
        return String.format("Load failed: %d failure(s): %s",
                failures.size(),
                failures.stream()
                        .map(f -> f.target() + ": " + f.message())
                        .collect(Collectors.joining(" | ")));
    }

    /**
     * One failing source ({@code gs://…}) or destination ({@code dataset.table}).
     */
    public record Failure(String target, String message, Throwable cause) {

        public static Failure of(String target, Throwable cause) {
            return new Failure(target, describe(cause), cause);
        }

        private static String describe(Throwable t) {
            StringBuilder sb = new StringBuilder(String.valueOf(t.getMessage()));
            Throwable c = t.getCause();
            while (c != null && c != t) {
                sb.append(": ").append(c.getMessage());
                t = c;
                c = c.getCause();
            }
            return sb.toString();
        }
    }
}
