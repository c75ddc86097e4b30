package com.shortlink.jobs.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortlink.domain.UrlStatistics;
import com.shortlink.jobs.JobName;
import com.shortlink.jobs.JobStatusSnapshot;
import com.shortlink.jobs.cleanup.CleanupJobStats;
import com.shortlink.jobs.cleanup.PasswordResetCleanupJob;
import com.shortlink.jobs.config.JobSchedulerProperties;
import com.shortlink.jobs.expiration.UrlStatisticsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class JobHealthCheckTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final ScheduleConfig CONFIG = ScheduleConfig.from(new JobSchedulerProperties());

    @Mock
    UrlStatisticsService urlStatisticsService;
    @Mock
    PasswordResetCleanupJob passwordResetCleanupJob;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private JobHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        healthCheck = new JobHealthCheck(urlStatisticsService, passwordResetCleanupJob,
                objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("healthy jobs produce no warnings")
    void evaluate_healthy() {
        SchedulerStatus status = status(snapshot(0, NOW.minus(Duration.ofMinutes(30))), snapshot(0, null));

        assertThat(healthCheck.evaluate(status, NOW)).isEmpty();
    }

    @Test
    @DisplayName("warns at three consecutive failures")
    void evaluate_consecutiveFailures() {
        SchedulerStatus status = status(snapshot(3, NOW.minus(Duration.ofMinutes(5))), snapshot(2, NOW));

        assertThat(healthCheck.evaluate(status, NOW))
                .containsExactly("URL expiration job has 3 consecutive failures");
    }

    @Test
    @DisplayName("warns when a job last ran more than two hours ago")
    void evaluate_staleRun() {
        SchedulerStatus status = status(snapshot(0, NOW.minus(Duration.ofMinutes(121))),
                snapshot(0, NOW.minus(Duration.ofMinutes(120))));

        assertThat(healthCheck.evaluate(status, NOW))
                .containsExactly("URL expiration job has not run in over 120 minutes");
    }

    @Test
    @DisplayName("scheduler status serializes to JSON with its configuration and timestamps")
    void schedulerStatus_serializes() throws Exception {
        String json = objectMapper.writeValueAsString(status(snapshot(3, NOW), snapshot(0, null)));

        assertThat(json)
                .contains("\"started\":true")
                .contains("\"URL_EXPIRATION\"")
                .contains("\"consecutiveFailures\":3")
                .contains("\"circuitBreakerThreshold\":5");
    }

    @Test
    @DisplayName("report logs statistics and warnings and never changes job state")
    void perform_logsReport(CapturedOutput output) {
        when(urlStatisticsService.getStatistics()).thenReturn(new UrlStatistics(10, 6, 4, 5, 3, 1));
        when(passwordResetCleanupJob.getStats()).thenReturn(CleanupJobStats.empty());

        healthCheck.perform(status(snapshot(3, NOW), snapshot(0, NOW)));

        assertThat(output.getOut())
                .contains("URL Statistics: {\"totalUrls\":10")
                .contains("Password Reset Cleanup Statistics: {\"lastRun\":null")
                .contains("Scheduler Status: {\"started\":true")
                .contains("URL expiration job has 3 consecutive failures")
                .doesNotContain("Health check failed");
        verify(urlStatisticsService).getStatistics();
        verify(passwordResetCleanupJob, never()).execute();
        verify(passwordResetCleanupJob, never()).resetStats();
    }

    @Test
    @DisplayName("a failing statistics query is logged, not thrown")
    void perform_swallowsErrors() {
        when(urlStatisticsService.getStatistics()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> healthCheck.perform(status(snapshot(0, NOW), snapshot(0, NOW))))
                .doesNotThrowAnyException();
    }

    private static SchedulerStatus status(JobStatusSnapshot url, JobStatusSnapshot cleanup) {
        return new SchedulerStatus(true,
                Map.of(JobName.URL_EXPIRATION, url, JobName.PASSWORD_RESET_CLEANUP, cleanup),
                Map.of(), CONFIG);
    }

    private static JobStatusSnapshot snapshot(int consecutiveFailures, Instant lastExecution) {
        return new JobStatusSnapshot(false, lastExecution, null, lastExecution, consecutiveFailures,
                consecutiveFailures, 0, consecutiveFailures);
    }
}
