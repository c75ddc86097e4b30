package com.shortlink.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Storage operations used by the URL expiration job and its monitoring.
 */
public interface UrlExpirationStore {

    /**
     * Links with expiryDate before {@code now} that are active, not deleted and not yet auto-expired,
     * oldest expiry first.
     */
    List<ExpiredUrlCandidate> findExpiredCandidates(int limit, long offset, Instant now);

    /**
     * Flips the given links to expired, but only those still active and not auto-expired.
     *
     * @return number of links actually modified
     */
    long markExpired(Collection<String> ids, Instant now);

    UrlStatistics aggregateStatistics(Instant now);

    /**
     * Soft-deletes links auto-expired before {@code cutoff}.
     *
     * @return number of links soft-deleted
     */
    long softDeleteAutoExpiredBefore(Instant cutoff, Instant now);
}
