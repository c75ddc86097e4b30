package com.shortlink.jobs;

import java.time.Instant;

/**
 * Read-only copy of a {@link JobStatus} at one point in time.
 */
public record JobStatusSnapshot(
        boolean running,
        Instant lastExecution,
        Instant lastSuccess,
        Instant lastFailure,
        int consecutiveFailures,
        long totalExecutions,
        long totalSuccesses,
        long totalFailures
) {
}
