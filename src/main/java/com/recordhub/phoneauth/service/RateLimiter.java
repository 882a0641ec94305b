package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.config.OtpProperties;
import com.recordhub.phoneauth.model.RateWindow;
import com.recordhub.phoneauth.repository.RateWindowRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fixed-window limiter for OTP sends, shared by issue and resend.
 * <p>
 * The counter lives in a {@link RateWindowRepository}, so the check and the increment are one
 * atomic store operation and the limit holds across instances.
 */
@Service
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    // Each round trip loses only when another request moved the window in between
    private static final int MAX_ROUNDS = 3;
    private static final Duration CONTENDED_RETRY_AFTER = Duration.ofSeconds(1);

    private final RateWindowRepository rateWindowRepository;
    private final OtpProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public RateLimiter(RateWindowRepository rateWindowRepository,
                       OtpProperties properties,
                       Clock clock,
                       MeterRegistry meterRegistry) {
        this.rateWindowRepository = rateWindowRepository;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Counts one request against the phone number's window if the ceiling allows it.
     */
    public RateLimitDecision checkAndConsume(String phoneNumber) {
        Duration windowLength = properties.getRateLimit().getWindow();
        int maxRequests = properties.getRateLimit().getMaxRequests();

        for (int round = 0; round < MAX_ROUNDS; round++) {
            Instant now = clock.instant();

            if (rateWindowRepository.incrementIfOpen(phoneNumber, now, windowLength, maxRequests).isPresent()) {
                return RateLimitDecision.allow();
            }
            if (rateWindowRepository.startIfClosed(phoneNumber, now, windowLength).isPresent()) {
                logger.debug("Started new rate window for {}", phoneNumber);
                return RateLimitDecision.allow();
            }

            Optional<RateWindow> current = rateWindowRepository.findByPhoneNumber(phoneNumber);
            if (current.isPresent() && current.get().isOpenAt(now, windowLength)
                    && current.get().getRequestCount() >= maxRequests) {
                Duration retryAfter = Duration.between(now, current.get().windowEnd(windowLength));
                logger.info("Rate limit exceeded for {}: {} requests in window, retry after {}",
                        phoneNumber, current.get().getRequestCount(), retryAfter);
                publishRateLimitMetric("ceiling");
                return RateLimitDecision.deny(retryAfter);
            }
            logger.debug("Rate window for {} changed concurrently, retrying (round {})", phoneNumber, round + 1);
        }

        logger.warn("Rate window for {} still contended after {} rounds, denying", phoneNumber, MAX_ROUNDS);
        publishRateLimitMetric("contended");
        return RateLimitDecision.deny(CONTENDED_RETRY_AFTER);
    }

    /**
     * Reports whether a request would currently be allowed, without counting one.
     */
    public boolean wouldAllow(String phoneNumber) {
        Duration windowLength = properties.getRateLimit().getWindow();
        Instant now = clock.instant();
        return rateWindowRepository.findByPhoneNumber(phoneNumber)
                .filter(window -> window.isOpenAt(now, windowLength))
                .map(window -> window.getRequestCount() < properties.getRateLimit().getMaxRequests())
                .orElse(true);
    }

    private void publishRateLimitMetric(String reason) {
        meterRegistry.counter("otp.rate_limited", "reason", reason).increment();
    }
}
