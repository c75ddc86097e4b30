package com.shortlink.jobs.expiration;

import com.shortlink.common.Sleeper;
import com.shortlink.domain.ExpiredUrlCandidate;
import com.shortlink.domain.UrlExpirationStore;
import com.shortlink.jobs.JobResult;
import com.shortlink.jobs.config.UrlExpirationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UrlExpirationJobTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    UrlExpirationStore store;
    @Mock
    Sleeper sleeper;

    private UrlExpirationJob job;

    @BeforeEach
    void setUp() {
        job = new UrlExpirationJob(store, new UrlExpirationProperties(), sleeper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("2500 expired links are processed in pages of 1000, 1000 and 500")
    void execute_pagesThroughAllCandidates() {
        when(store.findExpiredCandidates(eq(1000), eq(0L), eq(NOW))).thenReturn(candidates(0, 1000));
        when(store.findExpiredCandidates(eq(1000), eq(1000L), eq(NOW))).thenReturn(candidates(1000, 1000));
        when(store.findExpiredCandidates(eq(1000), eq(2000L), eq(NOW))).thenReturn(candidates(2000, 500));
        when(store.findExpiredCandidates(eq(1000), eq(3000L), eq(NOW))).thenReturn(List.of());
        when(store.markExpired(anyCollection(), eq(NOW))).thenAnswer(inv -> (long) inv.getArgument(0, List.class).size());

        JobResult result = job.execute(new UrlExpirationJob.Config(1000, 3, 5000));

        assertThat(result.success()).isTrue();
        assertThat(result.processedCount()).isEqualTo(2500);
        assertThat(result.expiredCount()).isEqualTo(2500);
        assertThat(result.errors()).isEmpty();
        assertThat(result.timestamp()).isEqualTo(NOW);
        verify(store, times(3)).markExpired(anyCollection(), eq(NOW));
    }

    @Test
    @DisplayName("no expired links yields a successful empty result")
    void execute_nothingToDo() {
        when(store.findExpiredCandidates(anyInt(), anyLong(), any())).thenReturn(List.of());

        JobResult result = job.execute();

        assertThat(result.success()).isTrue();
        assertThat(result.processedCount()).isZero();
        assertThat(result.expiredCount()).isZero();
        assertThat(result.errors()).isEmpty();
        verify(store, never()).markExpired(anyCollection(), any());
    }

    @Test
    @DisplayName("first page failing on every attempt is retried, skipped and the run ends as failed")
    void execute_firstPageExhausted() {
        when(store.findExpiredCandidates(eq(1000), eq(0L), eq(NOW))).thenReturn(candidates(0, 10));
        when(store.markExpired(anyCollection(), eq(NOW))).thenThrow(new DataAccessResourceFailureException("db down"));

        JobResult result = job.execute(new UrlExpirationJob.Config(1000, 3, 5000));

        assertThat(result.success()).isFalse();
        assertThat(result.processedCount()).isZero();
        assertThat(result.expiredCount()).isZero();
        assertThat(result.errors()).containsExactly("Batch 0: db down");
        verify(store, times(3)).markExpired(anyCollection(), eq(NOW));
        verify(store, never()).findExpiredCandidates(anyInt(), eq(1000L), any());
    }

    @Test
    @DisplayName("waits the configured delay between attempts")
    void execute_sleepsBetweenAttempts() throws InterruptedException {
        when(store.findExpiredCandidates(eq(1000), eq(0L), eq(NOW))).thenReturn(candidates(0, 10));
        when(store.markExpired(anyCollection(), eq(NOW))).thenThrow(new DataAccessResourceFailureException("db down"));

        job.execute(new UrlExpirationJob.Config(1000, 3, 5000));

        verify(sleeper, times(2)).sleep(5000L);
    }

    @Test
    @DisplayName("a failing later page is skipped and the run continues; partial success counts as success")
    void execute_laterPageExhausted_continues() {
        when(store.findExpiredCandidates(eq(10), eq(0L), eq(NOW))).thenReturn(candidates(0, 10));
        when(store.findExpiredCandidates(eq(10), eq(10L), eq(NOW)))
                .thenThrow(new DataAccessResourceFailureException("timeout"));
        when(store.findExpiredCandidates(eq(10), eq(20L), eq(NOW))).thenReturn(candidates(20, 4));
        when(store.findExpiredCandidates(eq(10), eq(30L), eq(NOW))).thenReturn(List.of());
        when(store.markExpired(anyCollection(), eq(NOW))).thenAnswer(inv -> (long) inv.getArgument(0, List.class).size());

        JobResult result = job.execute(new UrlExpirationJob.Config(10, 2, 0));

        assertThat(result.success()).isTrue();
        assertThat(result.processedCount()).isEqualTo(14);
        assertThat(result.expiredCount()).isEqualTo(14);
        assertThat(result.errors()).containsExactly("Batch 10: timeout");
        verify(store, times(2)).findExpiredCandidates(eq(10), eq(10L), eq(NOW));
    }

    @Test
    @DisplayName("links changed concurrently are processed but not counted as expired")
    void execute_concurrentChange_expiredBelowProcessed() {
        when(store.findExpiredCandidates(eq(1000), eq(0L), eq(NOW))).thenReturn(candidates(0, 5));
        when(store.findExpiredCandidates(eq(1000), eq(1000L), eq(NOW))).thenReturn(List.of());
        when(store.markExpired(anyCollection(), eq(NOW))).thenReturn(3L);

        JobResult result = job.execute();

        assertThat(result.success()).isTrue();
        assertThat(result.processedCount()).isEqualTo(5);
        assertThat(result.expiredCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("interrupt during a retry wait ends the run as failed")
    void execute_interruptedWait() throws InterruptedException {
        when(store.findExpiredCandidates(eq(1000), eq(0L), eq(NOW))).thenReturn(candidates(0, 1));
        when(store.markExpired(anyCollection(), eq(NOW))).thenThrow(new DataAccessResourceFailureException("db down"));
        doThrow(new InterruptedException()).when(sleeper).sleep(anyLong());

        try {
            JobResult result = job.execute();

            assertThat(result.success()).isFalse();
            assertThat(result.errors()).hasSize(1);
            assertThat(result.errors().get(0)).contains("interrupted");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void config_rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> new UrlExpirationJob.Config(0, 3, 5000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("old auto-expired links are soft-deleted with a cutoff of now minus the given days")
    void cleanupOldExpiredRecords_usesCutoff() {
        when(store.softDeleteAutoExpiredBefore(NOW.minus(Duration.ofDays(90)), NOW)).thenReturn(7L);

        assertThat(job.cleanupOldExpiredRecords()).isEqualTo(7);
    }

    @Test
    void cleanupOldExpiredRecords_rejectsNonPositiveDays() {
        assertThatThrownBy(() -> job.cleanupOldExpiredRecords(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("cleanup propagates storage errors")
    void cleanupOldExpiredRecords_propagatesErrors() {
        when(store.softDeleteAutoExpiredBefore(any(), any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> job.cleanupOldExpiredRecords(30)).isInstanceOf(DataAccessResourceFailureException.class);
    }

    private static List<ExpiredUrlCandidate> candidates(int from, int count) {
        List<ExpiredUrlCandidate> list = new ArrayList<>(count);
        IntStream.range(from, from + count).forEach(i -> list.add(new ExpiredUrlCandidate(
                "id-" + i, "code" + i, i % 3 == 0 ? null : "user-" + (i % 5),
                NOW.minusSeconds(100_000L - i), "https://example.com/" + i)));
        return list;
    }
}
