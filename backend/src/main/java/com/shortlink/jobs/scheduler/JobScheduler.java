package com.shortlink.jobs.scheduler;

import com.shortlink.jobs.JobName;
import com.shortlink.jobs.JobResult;
import com.shortlink.jobs.JobStatus;
import com.shortlink.jobs.JobStatusSnapshot;
import com.shortlink.jobs.cleanup.CleanupJobStats;
import com.shortlink.jobs.cleanup.PasswordResetCleanupJob;
import com.shortlink.jobs.config.JobSchedulerProperties;
import com.shortlink.jobs.expiration.UrlExpirationJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns timers, run guards and health reporting for background jobs. One instance per process.
 * <p>
 * Scheduled runs (timer fires and scheduler-level retries) are skipped while the job is running and
 * once its consecutive failures reach the circuit breaker threshold. Manual triggers bypass the
 * breaker but not the running guard, and a successful manual run closes the breaker again.
 * Job failures are recorded in {@link JobStatus}; they never escape into the timer threads.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobScheduler {

    private final TaskScheduler taskScheduler;
    private final UrlExpirationJob urlExpirationJob;
    private final PasswordResetCleanupJob passwordResetCleanupJob;
    private final JobHealthCheck jobHealthCheck;
    private final JobSchedulerProperties jobSchedulerProperties;
    private final Clock clock;

    private final Map<JobName, JobStatus> statuses = createStatuses();
    private final List<ScheduledFuture<?>> timers = Collections.synchronizedList(new ArrayList<>());
    /** First periodic fire per job, used to estimate the next execution. */
    private final Map<JobName, Instant> firstPeriodicRun = new EnumMap<>(JobName.class);

    private volatile boolean started;
    private volatile ScheduleConfig activeConfig;

    public boolean startScheduler() {
        return startScheduler(ScheduleConfig.from(jobSchedulerProperties));
    }

    /**
     * Arms periodic runs of every job, the periodic health check and one short delayed initial run of each.
     *
     * @return false when already started, disabled, or arming failed
     */
    public synchronized boolean startScheduler(ScheduleConfig config) {
        if (started) {
            log.warn("Job scheduler is already started");
            return false;
        }
        if (!config.enabled()) {
            log.info("Job scheduler is disabled");
            return false;
        }
        log.info("Starting job scheduler with interval: {} minutes", config.intervalMinutes());
        try {
            Instant now = clock.instant();
            for (JobName job : JobName.values()) {
                Duration interval = config.interval(job);
                Instant firstRun = now.plus(interval);
                timers.add(taskScheduler.scheduleAtFixedRate(() -> fireTimer(job), firstRun, interval));
                firstPeriodicRun.put(job, firstRun);
            }
            timers.add(taskScheduler.scheduleAtFixedRate(this::performHealthCheck,
                    now.plus(config.healthCheckInterval()), config.healthCheckInterval()));

            timers.add(taskScheduler.schedule(this::performHealthCheck,
                    now.plusSeconds(config.initialHealthCheckDelaySeconds())));
            for (JobName job : JobName.values()) {
                timers.add(taskScheduler.schedule(() -> fireTimer(job),
                        now.plusSeconds(config.initialJobDelaySeconds())));
            }

            activeConfig = config;
            started = true;
            log.info("Job scheduler started successfully");
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to start job scheduler: {}", e.getMessage(), e);
            cancelTimers();
            return false;
        }
    }

    /**
     * Cancels pending timers. In-flight runs are not interrupted and still record their outcome.
     *
     * @return false when the scheduler was not started
     */
    public synchronized boolean stopScheduler() {
        if (!started) {
            log.warn("Job scheduler is not running");
            return false;
        }
        log.info("Stopping job scheduler");
        try {
            cancelTimers();
            started = false;
            log.info("Job scheduler stopped successfully");
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to stop job scheduler: {}", e.getMessage(), e);
            return false;
        }
    }

    public boolean isStarted() {
        return started;
    }

    public synchronized SchedulerStatus getSchedulerStatus() {
        ScheduleConfig config = currentConfig();
        Map<JobName, JobStatusSnapshot> jobs = new EnumMap<>(JobName.class);
        statuses.forEach((name, status) -> jobs.put(name, status.snapshot()));
        Map<JobName, Instant> next = new EnumMap<>(JobName.class);
        if (started) {
            Instant now = clock.instant();
            firstPeriodicRun.forEach((name, first) -> next.put(name, nextFire(first, config.interval(name), now)));
        }
        return new SchedulerStatus(started, jobs, next, config);
    }

    /** Runs the URL expiration job now, bypassing timers and the circuit breaker. */
    public JobResult triggerUrlExpirationJob() {
        log.info("Manually triggering URL expiration job");
        return runTracked(JobName.URL_EXPIRATION)
                .orElseGet(() -> JobResult.failure("URL expiration job is already running", clock.instant()));
    }

    /** Runs the password reset cleanup job now, bypassing timers and the circuit breaker. */
    public boolean triggerPasswordResetCleanupJob() {
        log.info("Manually triggering password reset cleanup job");
        return runTracked(JobName.PASSWORD_RESET_CLEANUP)
                .map(JobResult::success)
                .orElse(false);
    }

    /**
     * Zeroes the counters of one job ({@link JobName#key()}) or of every job ({@link JobName#ALL}, also used
     * for null or blank). A run in flight keeps its running flag.
     */
    public void resetJobStatistics(String jobName) {
        String key = jobName == null || jobName.isBlank() ? JobName.ALL : jobName.strip();
        boolean all = JobName.ALL.equalsIgnoreCase(key);
        Optional<JobName> single = JobName.fromKey(key);
        if (!all && single.isEmpty()) {
            throw new IllegalArgumentException("Unknown job name: " + jobName);
        }
        for (JobName name : JobName.values()) {
            if (all || single.get() == name) {
                statuses.get(name).resetCounters();
                if (name == JobName.PASSWORD_RESET_CLEANUP) {
                    passwordResetCleanupJob.resetStats();
                }
                log.info("{} job statistics reset ({})", name.displayName(), name.key());
            }
        }
    }

    /** Timer and retry entry point. A fire that raced with stopScheduler() does nothing. */
    void fireTimer(JobName job) {
        if (!started) {
            log.debug("Job scheduler is stopped, ignoring {} timer", job.displayName());
            return;
        }
        runScheduled(job);
    }

    void runScheduled(JobName job) {
        ScheduleConfig config = currentConfig();
        JobStatus status = statuses.get(job);
        int failures = status.getConsecutiveFailures();
        if (failures >= config.circuitBreakerThreshold()) {
            log.error("{} job has failed {} times consecutively, manual intervention required",
                    job.displayName(), failures);
            return;
        }
        Optional<JobResult> outcome = runTracked(job);
        if (outcome.isEmpty()) {
            return;
        }
        JobResult result = outcome.get();
        if (result.success()) {
            log.info("{} job completed successfully: {} processed, {} expired in {}ms",
                    job.displayName(), result.processedCount(), result.expiredCount(), result.executionTimeMs());
        } else {
            log.error("{} job completed with errors: {}", job.displayName(), String.join(", ", result.errors()));
            scheduleRetryIfAllowed(job, status, config);
        }
    }

    void performHealthCheck() {
        jobHealthCheck.perform(getSchedulerStatus());
    }

    /** Empty when the job was already running and nothing was executed. */
    private Optional<JobResult> runTracked(JobName job) {
        JobStatus status = statuses.get(job);
        if (!status.tryStart()) {
            log.warn("{} job is already running, skipping this execution", job.displayName());
            return Optional.empty();
        }
        JobResult result = JobResult.failure(job.displayName() + " job did not complete", clock.instant());
        try {
            result = execute(job);
        } catch (RuntimeException e) {
            String detail = JobResult.describe(e);
            log.error("{} job execution failed: {}", job.displayName(), detail, e);
            result = JobResult.failure(detail, clock.instant());
        } finally {
            status.finish(result);
        }
        return Optional.of(result);
    }

    private JobResult execute(JobName job) {
        return switch (job) {
            case URL_EXPIRATION -> urlExpirationJob.execute();
            case PASSWORD_RESET_CLEANUP -> executePasswordResetCleanup();
        };
    }

    private JobResult executePasswordResetCleanup() {
        Instant startedAt = clock.instant();
        boolean ok = passwordResetCleanupJob.execute();
        CleanupJobStats stats = passwordResetCleanupJob.getStats();
        long elapsedMs = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
        if (ok) {
            return new JobResult(true, stats.lastCleanupCount(), stats.lastCleanupCount(), List.of(), elapsedMs, startedAt);
        }
        String error = stats.lastError() != null ? stats.lastError() : "Password reset cleanup failed";
        return new JobResult(false, 0, 0, List.of(error), elapsedMs, startedAt);
    }

    /** Holds the scheduler monitor so a retry is never armed after stopScheduler() cancelled the timers. */
    private synchronized void scheduleRetryIfAllowed(JobName job, JobStatus status, ScheduleConfig config) {
        if (!config.retryOnFailure() || !started || status.getConsecutiveFailures() >= config.retryFailureLimit()) {
            return;
        }
        log.info("Scheduling retry of {} job in {} minutes", job.displayName(), config.retryDelayMinutes());
        synchronized (timers) {
            timers.removeIf(Future::isDone);
            timers.add(taskScheduler.schedule(() -> fireTimer(job), clock.instant().plus(config.retryDelay())));
        }
    }

    private void cancelTimers() {
        synchronized (timers) {
            for (ScheduledFuture<?> timer : timers) {
                timer.cancel(false);
            }
            timers.clear();
        }
        firstPeriodicRun.clear();
    }

    private ScheduleConfig currentConfig() {
        ScheduleConfig config = activeConfig;
        return config != null ? config : ScheduleConfig.from(jobSchedulerProperties);
    }

    private static Instant nextFire(Instant first, Duration interval, Instant now) {
        if (now.isBefore(first)) {
            return first;
        }
        long elapsedMs = Duration.between(first, now).toMillis();
        long periods = elapsedMs / interval.toMillis() + 1;
        return first.plus(interval.multipliedBy(periods));
    }

    private static Map<JobName, JobStatus> createStatuses() {
        Map<JobName, JobStatus> map = new EnumMap<>(JobName.class);
        for (JobName name : JobName.values()) {
            map.put(name, new JobStatus());
        }
        return Collections.unmodifiableMap(map);
    }
}
