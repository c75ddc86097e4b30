package com.shortlink.jobs.scheduler;

import com.shortlink.jobs.JobName;
import com.shortlink.jobs.config.JobSchedulerProperties;

import java.time.Duration;

/**
 * Scheduler settings frozen for one start/stop cycle.
 */
public record ScheduleConfig(
        boolean enabled,
        int intervalMinutes,
        int passwordResetCleanupIntervalMinutes,
        int healthCheckIntervalMinutes,
        int maxConcurrentJobs,
        boolean retryOnFailure,
        int retryDelayMinutes,
        int initialJobDelaySeconds,
        int initialHealthCheckDelaySeconds,
        int circuitBreakerThreshold,
        int retryFailureLimit,
        int healthWarningFailureThreshold,
        int staleRunThresholdMinutes
) {

    public ScheduleConfig {
        requirePositive(intervalMinutes, "intervalMinutes");
        requirePositive(passwordResetCleanupIntervalMinutes, "passwordResetCleanupIntervalMinutes");
        requirePositive(healthCheckIntervalMinutes, "healthCheckIntervalMinutes");
        requirePositive(retryDelayMinutes, "retryDelayMinutes");
        requirePositive(circuitBreakerThreshold, "circuitBreakerThreshold");
        if (maxConcurrentJobs != 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be 1");
        }
    }

    public static ScheduleConfig from(JobSchedulerProperties p) {
        return new ScheduleConfig(
                p.isEnabled(),
                p.getIntervalMinutes(),
                p.getPasswordResetCleanupIntervalMinutes(),
                p.getHealthCheckIntervalMinutes(),
                p.getMaxConcurrentJobs(),
                p.isRetryOnFailure(),
                p.getRetryDelayMinutes(),
                p.getInitialJobDelaySeconds(),
                p.getInitialHealthCheckDelaySeconds(),
                p.getCircuitBreakerThreshold(),
                p.getRetryFailureLimit(),
                p.getHealthWarningFailureThreshold(),
                p.getStaleRunThresholdMinutes());
    }

    public Duration interval(JobName job) {
        return switch (job) {
            case URL_EXPIRATION -> Duration.ofMinutes(intervalMinutes);
            case PASSWORD_RESET_CLEANUP -> Duration.ofMinutes(passwordResetCleanupIntervalMinutes);
        };
    }

    public Duration healthCheckInterval() {
        return Duration.ofMinutes(healthCheckIntervalMinutes);
    }

    public Duration retryDelay() {
        return Duration.ofMinutes(retryDelayMinutes);
    }

    public Duration staleRunThreshold() {
        return Duration.ofMinutes(staleRunThresholdMinutes);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
