package com.recordhub.phoneauth.exception;

import java.time.Duration;

/**
 * Thrown when a phone number has used its OTP request budget for the current window.
 */
public class RateLimitedException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("Too many OTP requests. Retry after " + retryAfterSeconds(retryAfter) + " seconds.");
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds(retryAfter);
    }

    // Rounded up so a client never retries before the window resets
    private static long retryAfterSeconds(Duration retryAfter) {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : Math.max(1, seconds);
    }
}
