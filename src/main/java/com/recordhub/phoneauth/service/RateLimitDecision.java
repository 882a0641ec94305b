package com.recordhub.phoneauth.service;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#checkAndConsume(String)}. {@code retryAfter} is zero when allowed
 * and strictly positive when denied.
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter) {

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Duration.ZERO);
    }

    public static RateLimitDecision deny(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter);
    }
}
