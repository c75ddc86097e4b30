package com.shortlink.domain;

import java.time.Instant;

/**
 * Projection of a link whose expiry passed but which has not been flipped to expired yet.
 */
public record ExpiredUrlCandidate(
        String id,
        String shortCode,
        String userId,
        Instant expiryDate,
        String originalUrl
) {
}
