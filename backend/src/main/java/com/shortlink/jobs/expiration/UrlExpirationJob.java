package com.shortlink.jobs.expiration;

import com.shortlink.common.RetryExhaustedException;
import com.shortlink.common.RetryPolicy;
import com.shortlink.common.Sleeper;
import com.shortlink.domain.ExpiredUrlCandidate;
import com.shortlink.domain.UrlExpirationStore;
import com.shortlink.jobs.JobResult;
import com.shortlink.jobs.config.UrlExpirationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flips links whose expiry passed to expired, page by page, oldest expiry first.
 * <p>
 * Each page is fetched and conditionally updated as one unit; a failing page is retried with a fixed
 * delay and skipped once its attempts are exhausted. The offset only moves forward, so a page that
 * keeps failing cannot stall the scan. After a skip the scan goes on only if this run already
 * processed something.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UrlExpirationJob {

    static final String ANONYMOUS = "anonymous";

    private final UrlExpirationStore urlExpirationStore;
    private final UrlExpirationProperties urlExpirationProperties;
    private final Sleeper sleeper;
    private final Clock clock;

    public record Config(int batchSize, int maxRetries, long retryDelayMs) {

        public Config {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
        }

        public static Config from(UrlExpirationProperties properties) {
            return new Config(properties.getBatchSize(), properties.getMaxRetries(), properties.getRetryDelayMs());
        }
    }

    private record BatchOutcome(long processedCount, long expiredCount) {
        static final BatchOutcome EMPTY = new BatchOutcome(0, 0);
    }

    public JobResult execute() {
        return execute(Config.from(urlExpirationProperties));
    }

    public JobResult execute(Config config) {
        Instant startedAt = clock.instant();
        RetryPolicy retryPolicy = new RetryPolicy(config.maxRetries(), config.retryDelayMs(), sleeper);
        List<String> errors = new ArrayList<>();
        long totalProcessed = 0;
        long totalExpired = 0;

        log.info("Starting URL expiration job (batchSize={}, maxRetries={})", config.batchSize(), config.maxRetries());
        try {
            long offset = 0;
            boolean hasMoreData = true;
            while (hasMoreData) {
                long pageOffset = offset;
                try {
                    BatchOutcome outcome = retryPolicy.execute(
                            () -> processBatch(config.batchSize(), pageOffset),
                            "URL expiration batch at offset " + pageOffset);
                    if (outcome.processedCount() == 0) {
                        hasMoreData = false;
                    } else {
                        totalProcessed += outcome.processedCount();
                        totalExpired += outcome.expiredCount();
                        // Advances even though the rows just expired left the candidate set, so a backlog
                        // larger than one page is only partly covered per run; the next run picks up the rest.
                        offset += config.batchSize();
                    }
                } catch (RetryExhaustedException e) {
                    errors.add("Batch " + pageOffset + ": " + JobResult.describe(e.getCause()));
                    log.error("URL expiration batch at offset {} failed after {} attempts, skipping batch",
                            pageOffset, e.getAttempts());
                    offset += config.batchSize();
                    hasMoreData = totalProcessed > 0;
                }
            }
        } catch (RuntimeException e) {
            String detail = JobResult.describe(e);
            log.error("URL expiration job failed: {}", detail, e);
            errors.add(detail);
            return new JobResult(false, totalProcessed, totalExpired, errors, elapsedMs(startedAt), startedAt);
        }

        long executionTimeMs = elapsedMs(startedAt);
        boolean success = errors.isEmpty() || totalExpired > 0;
        log.info("URL expiration job completed: {} URLs expired out of {} processed in {}ms",
                totalExpired, totalProcessed, executionTimeMs);
        return new JobResult(success, totalProcessed, totalExpired, errors, executionTimeMs, startedAt);
    }

    /**
     * Soft-deletes links auto-expired more than {@code daysOld} days ago. Storage errors propagate.
     *
     * @return number of links soft-deleted
     */
    public long cleanupOldExpiredRecords(int daysOld) {
        if (daysOld <= 0) {
            throw new IllegalArgumentException("daysOld must be positive");
        }
        Instant now = clock.instant();
        long cleaned = urlExpirationStore.softDeleteAutoExpiredBefore(now.minus(Duration.ofDays(daysOld)), now);
        if (cleaned > 0) {
            log.info("Cleaned up {} old expired URL records (older than {} days)", cleaned, daysOld);
        }
        return cleaned;
    }

    public long cleanupOldExpiredRecords() {
        return cleanupOldExpiredRecords(urlExpirationProperties.getCleanupAfterDays());
    }

    private BatchOutcome processBatch(int batchSize, long offset) {
        log.info("Processing URL expiration batch: offset {}, limit {}", offset, batchSize);
        Instant now = clock.instant();
        List<ExpiredUrlCandidate> candidates = urlExpirationStore.findExpiredCandidates(batchSize, offset, now);
        if (candidates.isEmpty()) {
            log.info("No more expired URLs to process");
            return BatchOutcome.EMPTY;
        }
        List<String> ids = candidates.stream().map(ExpiredUrlCandidate::id).toList();
        long updated = urlExpirationStore.markExpired(ids, now);
        logExpirationEvents(candidates, updated);
        return new BatchOutcome(candidates.size(), updated);
    }

    private void logExpirationEvents(List<ExpiredUrlCandidate> candidates, long updatedCount) {
        log.info("URL Expiration Job: Processed {} expired URLs, updated {} records", candidates.size(), updatedCount);
        Map<String, Integer> perUser = new LinkedHashMap<>();
        for (ExpiredUrlCandidate url : candidates) {
            String user = url.userId() != null ? url.userId() : ANONYMOUS;
            log.info("URL expired: {} (ID: {}, User: {}, Expiry: {})", url.shortCode(), url.id(), user, url.expiryDate());
            perUser.merge(user, 1, Integer::sum);
        }
        log.info("URL Expiration Summary: {}", perUser);
    }

    private long elapsedMs(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }
}
