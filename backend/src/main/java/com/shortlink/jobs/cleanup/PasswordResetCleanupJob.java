package com.shortlink.jobs.cleanup;

import com.shortlink.account.PasswordResetTokenService;
import com.shortlink.jobs.JobResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Removes expired password reset tokens in one idempotent step. No batching and no retry:
 * a failed attempt is counted and reported as false, never thrown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PasswordResetCleanupJob {

    private final PasswordResetTokenService passwordResetTokenService;
    private final Clock clock;

    private CleanupJobStats stats = CleanupJobStats.empty();

    public boolean execute() {
        try {
            log.info("Starting password reset token cleanup job...");
            long cleanedCount = passwordResetTokenService.cleanupExpiredPasswordResetTokens();
            synchronized (this) {
                stats = stats.withSuccess(clock.instant(), cleanedCount);
            }
            if (cleanedCount > 0) {
                log.info("Password reset cleanup job completed: {} expired tokens removed", cleanedCount);
            } else {
                log.debug("Password reset cleanup job completed: No expired tokens found");
            }
            return true;
        } catch (RuntimeException e) {
            String detail = JobResult.describe(e);
            synchronized (this) {
                stats = stats.withFailure(detail);
            }
            log.error("Password reset cleanup job failed: {}", detail, e);
            return false;
        }
    }

    public synchronized CleanupJobStats getStats() {
        return stats;
    }

    public synchronized void resetStats() {
        stats = CleanupJobStats.empty();
        log.info("Password reset cleanup job statistics reset");
    }
}
