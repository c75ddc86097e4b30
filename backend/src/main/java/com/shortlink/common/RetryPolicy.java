package com.shortlink.common;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Bounded retry with a fixed delay between attempts. {@code maxAttempts} counts the first call.
 * Only {@link RuntimeException}s are retried; the last one is rethrown inside {@link RetryExhaustedException}.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final long delayMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long delayMs, Sleeper sleeper) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.delayMs = delayMs;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code operation} until it returns or {@code maxAttempts} calls have failed.
     *
     * @throws RetryExhaustedException when every attempt failed
     * @throws IllegalStateException   when the thread is interrupted while waiting between attempts
     */
    public <T> T execute(Supplier<T> operation, String operationName) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("{} failed (attempt {}/{}): {}", operationName, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(operationName);
                }
            }
        }
        throw new RetryExhaustedException(operationName, maxAttempts, lastFailure);
    }

    private void pause(String operationName) {
        if (delayMs == 0) {
            return;
        }
        log.info("Retrying {} in {}ms...", operationName, delayMs);
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(operationName + " retry interrupted", e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMs() {
        return delayMs;
    }
}
