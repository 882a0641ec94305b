package com.recordhub.phoneauth.repository.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.recordhub.phoneauth.model.RateWindow;
import com.recordhub.phoneauth.repository.RateWindowRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caffeine backed {@link RateWindowRepository}. Only correct while a single instance serves
 * all requests; multi-instance deployments use the DynamoDB store.
 */
public class InMemoryRateWindowRepository implements RateWindowRepository {

    private final Cache<String, RateWindow> windows;

    public InMemoryRateWindowRepository(Duration expireAfter) {
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(expireAfter)
                .maximumSize(100_000)
                .build();
    }

    @Override
    public Optional<RateWindow> findByPhoneNumber(String phoneNumber) {
        return Optional.ofNullable(windows.getIfPresent(phoneNumber)).map(InMemoryRateWindowRepository::copyOf);
    }

    @Override
    public Optional<RateWindow> incrementIfOpen(String phoneNumber, Instant now, Duration windowLength, int maxRequests) {
        AtomicReference<RateWindow> updated = new AtomicReference<>();
        windows.asMap().computeIfPresent(phoneNumber, (key, current) -> {
            if (!current.isOpenAt(now, windowLength) || current.getRequestCount() >= maxRequests) {
                return current;
            }
            RateWindow next = copyOf(current);
            next.setRequestCount(current.getRequestCount() + 1);
            updated.set(copyOf(next));
            return next;
        });
        return Optional.ofNullable(updated.get());
    }

    @Override
    public Optional<RateWindow> startIfClosed(String phoneNumber, Instant now, Duration windowLength) {
        AtomicReference<RateWindow> started = new AtomicReference<>();
        windows.asMap().compute(phoneNumber, (key, current) -> {
            if (current != null && current.isOpenAt(now, windowLength)) {
                return current;
            }
            RateWindow next = new RateWindow(phoneNumber, now, 1,
                    now.plus(windowLength.multipliedBy(2)).getEpochSecond());
            started.set(copyOf(next));
            return next;
        });
        return Optional.ofNullable(started.get());
    }

    private static RateWindow copyOf(RateWindow source) {
        return new RateWindow(source.getPhoneNumber(), source.getWindowStart(), source.getRequestCount(), source.getTtl());
    }
}
