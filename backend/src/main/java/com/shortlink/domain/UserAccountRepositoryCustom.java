package com.shortlink.domain;

import java.time.Instant;

/**
 * Custom bulk updates for users.
 */
public interface UserAccountRepositoryCustom {

    /**
     * Clears reset token and expiry on every account whose token expired before {@code now}.
     *
     * @return number of accounts modified
     */
    long clearPasswordResetTokensExpiredBefore(Instant now);
}
