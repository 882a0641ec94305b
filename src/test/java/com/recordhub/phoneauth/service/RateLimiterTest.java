package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.config.OtpProperties;
import com.recordhub.phoneauth.repository.RateWindowRepository;
import com.recordhub.phoneauth.repository.impl.InMemoryRateWindowRepository;
import com.recordhub.phoneauth.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RateLimiter Tests")
class RateLimiterTest {

    private static final String PHONE = "+15551234567";

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private OtpProperties properties;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        properties = new OtpProperties();
        rateLimiter = new RateLimiter(new InMemoryRateWindowRepository(Duration.ofMinutes(2)), properties, clock, meterRegistry);
    }

    @Test
    @DisplayName("Allows the ceiling, then denies with the time left in the window")
    void deniesOnceCeilingReached() {
        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isTrue();
        clock.advance(Duration.ofSeconds(10));
        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isTrue();
        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isTrue();

        RateLimitDecision denied = rateLimiter.checkAndConsume(PHONE);

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.retryAfter()).isEqualTo(Duration.ofSeconds(50));
        assertThat(meterRegistry.counter("otp.rate_limited", "reason", "ceiling").count()).isEqualTo(1.0);
    }

    @Test
    void newWindowStartsAfterTheOldOneCloses() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.checkAndConsume(PHONE);
        }
        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isFalse();

        clock.advance(Duration.ofMinutes(1));

        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isTrue();
        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isTrue();
    }

    @Test
    void budgetsArePerPhoneNumber() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.checkAndConsume(PHONE);
        }

        assertThat(rateLimiter.checkAndConsume("+15557654321").allowed()).isTrue();
    }

    @Test
    void wouldAllow_doesNotConsume() {
        rateLimiter.checkAndConsume(PHONE);
        rateLimiter.checkAndConsume(PHONE);

        assertThat(rateLimiter.wouldAllow(PHONE)).isTrue();
        assertThat(rateLimiter.wouldAllow(PHONE)).isTrue();
        assertThat(rateLimiter.checkAndConsume(PHONE).allowed()).isTrue();
        assertThat(rateLimiter.wouldAllow(PHONE)).isFalse();
        assertThat(rateLimiter.wouldAllow("+15557654321")).isTrue();
    }

    @Test
    @DisplayName("Denies briefly when the window keeps changing under it")
    void deniesWhenContended() {
        RateWindowRepository repository = mock(RateWindowRepository.class);
        when(repository.incrementIfOpen(eq(PHONE), any(), any(), anyInt())).thenReturn(Optional.empty());
        when(repository.startIfClosed(eq(PHONE), any(), any())).thenReturn(Optional.empty());
        when(repository.findByPhoneNumber(PHONE)).thenReturn(Optional.empty());
        RateLimiter contended = new RateLimiter(repository, properties, clock, meterRegistry);

        RateLimitDecision decision = contended.checkAndConsume(PHONE);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(1));
        verify(repository, times(3)).startIfClosed(eq(PHONE), any(), any());
    }

    @Test
    @DisplayName("Concurrent requests never exceed the ceiling")
    void concurrentRequestsRespectCeiling() throws Exception {
        int threads = 24;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RateLimitDecision>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return rateLimiter.checkAndConsume(PHONE);
                }));
            }
            start.countDown();

            int allowed = 0;
            for (Future<RateLimitDecision> result : results) {
                RateLimitDecision decision = result.get(10, TimeUnit.SECONDS);
                if (decision.allowed()) {
                    allowed++;
                } else {
                    assertThat(decision.retryAfter()).isPositive();
                }
            }
            assertThat(allowed).isEqualTo(3);
        } finally {
            executor.shutdownNow();
        }
    }
}
