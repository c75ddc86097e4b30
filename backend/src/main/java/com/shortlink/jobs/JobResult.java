package com.shortlink.jobs;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one job run. Errors keep the order in which they occurred.
 */
public record JobResult(
        boolean success,
        long processedCount,
        long expiredCount,
        List<String> errors,
        long executionTimeMs,
        Instant timestamp
) {

    public JobResult {
        if (processedCount < 0 || expiredCount < 0 || executionTimeMs < 0) {
            throw new IllegalArgumentException("counts and execution time must not be negative");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Failed run that produced nothing, e.g. a job body that threw or was skipped. */
    public static JobResult failure(String message, Instant timestamp) {
        return new JobResult(false, 0, 0, List.of(message), 0, timestamp);
    }

    /** Message of {@code e}, with its cause appended when present. Never null. */
    public static String describe(Throwable e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()
                && !detail.contains(cause.getMessage())) {
            detail = detail + " (" + cause.getMessage() + ")";
        }
        return detail;
    }
}
