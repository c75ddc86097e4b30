package com.shortlink.jobs.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Job scheduler config. Intervals are in minutes unless the name says otherwise.
 */
@ConfigurationProperties(prefix = "shortlink.jobs.scheduler")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class JobSchedulerProperties {

    /** Master switch; when false startScheduler() arms nothing. */
    private boolean enabled = true;

    @Positive
    private int intervalMinutes = 60;

    @Positive
    private int passwordResetCleanupIntervalMinutes = 60;

    @Positive
    private int healthCheckIntervalMinutes = 30;

    /** Runs allowed in flight per job. Only 1 is supported. */
    @Positive
    private int maxConcurrentJobs = 1;

    /** Arm one delayed re-run after a failed scheduled run. */
    private boolean retryOnFailure = true;

    @Positive
    private int retryDelayMinutes = 15;

    /** Delay before the first run of each job after start, so jobs run shortly after boot. */
    @Positive
    private int initialJobDelaySeconds = 10;

    @Positive
    private int initialHealthCheckDelaySeconds = 5;

    /** Consecutive failures after which scheduled runs are skipped until a manual run succeeds. */
    @Positive
    private int circuitBreakerThreshold = 5;

    /** Scheduler-level retries are armed only while consecutive failures are below this. */
    @Positive
    private int retryFailureLimit = 3;

    /** Health check warns from this many consecutive failures. */
    @Positive
    private int healthWarningFailureThreshold = 3;

    /** Health check warns when a job's last run is older than this. */
    @Positive
    private int staleRunThresholdMinutes = 120;
}
