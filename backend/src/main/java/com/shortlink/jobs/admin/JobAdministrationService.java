package com.shortlink.jobs.admin;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.shortlink.domain.UrlStatistics;
import com.shortlink.jobs.JobResult;
import com.shortlink.jobs.expiration.UrlExpirationJob;
import com.shortlink.jobs.expiration.UrlStatisticsService;
import com.shortlink.jobs.scheduler.JobScheduler;
import com.shortlink.jobs.scheduler.SchedulerStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operator-facing entry point for job status, manual runs and cache maintenance.
 * Transport-neutral: whatever exposes it (admin endpoint, shell) only maps these calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAdministrationService {

    private final JobScheduler jobScheduler;
    private final UrlStatisticsService urlStatisticsService;
    private final UrlExpirationJob urlExpirationJob;
    private final CacheManager cacheManager;
    private final Clock clock;

    public record JobStatusReport(SchedulerStatus scheduler, UrlStatistics urlStatistics, Instant generatedAt) {
    }

    public record CacheStatistics(long estimatedSize, long hitCount, long missCount, double hitRate) {
    }

    public JobStatusReport getJobStatus() {
        return new JobStatusReport(jobScheduler.getSchedulerStatus(), urlStatisticsService.getStatistics(),
                clock.instant());
    }

    public JobResult triggerExpirationJob() {
        JobResult result = jobScheduler.triggerUrlExpirationJob();
        urlStatisticsService.evict();
        return result;
    }

    public boolean triggerPasswordResetCleanupJob() {
        return jobScheduler.triggerPasswordResetCleanupJob();
    }

    /**
     * @param jobName {@code urlExpiration}, {@code passwordResetCleanup} or {@code all}; null or blank means all
     * @throws IllegalArgumentException for an unknown job name
     */
    public void resetJobStatistics(String jobName) {
        jobScheduler.resetJobStatistics(jobName);
    }

    /** Soft-deletes links auto-expired longer ago than the configured retention. */
    public long cleanupOldExpiredRecords() {
        long cleaned = urlExpirationJob.cleanupOldExpiredRecords();
        urlStatisticsService.evict();
        return cleaned;
    }

    public UrlStatistics getExpirationStatistics() {
        return urlStatisticsService.getStatistics();
    }

    /** Counters per Caffeine-backed cache, keyed by cache name. Other cache types are skipped. */
    public Map<String, CacheStatistics> getCacheStatistics() {
        Map<String, CacheStatistics> result = new TreeMap<>();
        for (String name : cacheManager.getCacheNames()) {
            Cache cache = cacheManager.getCache(name);
            if (cache instanceof CaffeineCache caffeineCache) {
                com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache = caffeineCache.getNativeCache();
                CacheStats stats = nativeCache.stats();
                result.put(name, new CacheStatistics(nativeCache.estimatedSize(), stats.hitCount(),
                        stats.missCount(), stats.hitRate()));
            }
        }
        return result;
    }

    public void clearCaches() {
        for (String name : cacheManager.getCacheNames()) {
            Cache cache = cacheManager.getCache(name);
            if (cache != null) {
                cache.clear();
            }
        }
        log.info("All caches cleared");
    }
}
