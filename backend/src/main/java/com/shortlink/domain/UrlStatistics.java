package com.shortlink.domain;

/**
 * Link counts by lifecycle state, soft-deleted links excluded.
 */
public record UrlStatistics(
        long totalUrls,
        long activeUrls,
        long inactiveUrls,
        long expiredUrls,
        long autoExpiredUrls,
        long expiringSoonUrls
) {
}
