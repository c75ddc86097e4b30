package com.shortlink.jobs.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortlink.jobs.JobName;
import com.shortlink.jobs.JobStatusSnapshot;
import com.shortlink.jobs.cleanup.PasswordResetCleanupJob;
import com.shortlink.jobs.expiration.UrlStatisticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Periodic observational report: logs link statistics, cleanup statistics and scheduler status,
 * and warns about repeated failures or jobs that stopped running. Never changes job state.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobHealthCheck {

    private final UrlStatisticsService urlStatisticsService;
    private final PasswordResetCleanupJob passwordResetCleanupJob;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void perform(SchedulerStatus status) {
        try {
            log.info("Performing job scheduler health check");
            log.info("URL Statistics: {}", objectMapper.writeValueAsString(urlStatisticsService.getStatistics()));
            log.info("Password Reset Cleanup Statistics: {}",
                    objectMapper.writeValueAsString(passwordResetCleanupJob.getStats()));
            log.info("Scheduler Status: {}", objectMapper.writeValueAsString(status));
            for (String warning : evaluate(status, clock.instant())) {
                log.warn(warning);
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
        }
    }

    /** Warnings for the given status; empty when every job looks healthy. */
    List<String> evaluate(SchedulerStatus status, Instant now) {
        ScheduleConfig config = status.configuration();
        List<String> warnings = new ArrayList<>();
        for (JobName name : JobName.values()) {
            JobStatusSnapshot job = status.job(name);
            if (job == null) {
                continue;
            }
            if (job.consecutiveFailures() >= config.healthWarningFailureThreshold()) {
                warnings.add(name.displayName() + " job has " + job.consecutiveFailures() + " consecutive failures");
            }
            Duration threshold = config.staleRunThreshold();
            if (job.lastExecution() != null && job.lastExecution().plus(threshold).isBefore(now)) {
                warnings.add(name.displayName() + " job has not run in over " + threshold.toMinutes() + " minutes");
            }
        }
        return warnings;
    }
}
