package com.shortlink.jobs.cleanup;

import java.time.Instant;

/**
 * Cumulative statistics of the password reset cleanup job.
 */
public record CleanupJobStats(
        Instant lastRun,
        long totalRuns,
        long totalTokensCleanedUp,
        long lastCleanupCount,
        long errors,
        String lastError
) {

    public static CleanupJobStats empty() {
        return new CleanupJobStats(null, 0, 0, 0, 0, null);
    }

    CleanupJobStats withSuccess(Instant runAt, long cleanedCount) {
        return new CleanupJobStats(runAt, totalRuns + 1, totalTokensCleanedUp + cleanedCount, cleanedCount,
                errors, lastError);
    }

    CleanupJobStats withFailure(String error) {
        return new CleanupJobStats(lastRun, totalRuns, totalTokensCleanedUp, lastCleanupCount, errors + 1, error);
    }
}
