package com.shortlink.jobs.expiration;

import com.shortlink.config.CaffeineConfig;
import com.shortlink.domain.UrlExpirationStore;
import com.shortlink.domain.UrlStatistics;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Link counts for monitoring. Cached briefly since each call runs several count queries.
 */
@Service
@RequiredArgsConstructor
public class UrlStatisticsService {

    private final UrlExpirationStore urlExpirationStore;
    private final Clock clock;

    @Cacheable(CaffeineConfig.URL_STATISTICS_CACHE)
    public UrlStatistics getStatistics() {
        return urlExpirationStore.aggregateStatistics(clock.instant());
    }

    /** Drops the cached counts, e.g. after a manual expiration run changed them. */
    @CacheEvict(value = CaffeineConfig.URL_STATISTICS_CACHE, allEntries = true)
    public void evict() {
    }
}
