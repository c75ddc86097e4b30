package com.shortlink.common;

/**
 * Thrown by {@link RetryPolicy} when every attempt failed. The cause is the last attempt's failure.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, RuntimeException lastFailure) {
        super(operationName + " failed after " + attempts + " attempt(s)", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
