package com.shortlink.account;

import com.shortlink.domain.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Password reset token housekeeping. Issuing and verifying tokens lives in the auth flow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetTokenService {

    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    /**
     * Removes reset tokens whose validity window has passed.
     *
     * @return number of accounts whose token was cleared
     */
    public long cleanupExpiredPasswordResetTokens() {
        long cleared = userAccountRepository.clearPasswordResetTokensExpiredBefore(clock.instant());
        log.debug("Cleared {} expired password reset token(s)", cleared);
        return cleared;
    }
}
