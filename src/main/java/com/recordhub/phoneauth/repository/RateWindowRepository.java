package com.recordhub.phoneauth.repository;

import com.recordhub.phoneauth.model.RateWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Counter store behind the OTP rate limiter. Both mutating verbs are single atomic operations;
 * for a given phone number and instant exactly one of them can succeed.
 */
public interface RateWindowRepository {

    Optional<RateWindow> findByPhoneNumber(String phoneNumber);

    /**
     * Increments the counter if the current window is still open and below {@code maxRequests}.
     *
     * @return the window after the increment, or empty if the window is closed, missing or full
     */
    Optional<RateWindow> incrementIfOpen(String phoneNumber, Instant now, Duration windowLength, int maxRequests);

    /**
     * Starts a new window with a count of one if there is no window or the current one has closed.
     *
     * @return the new window, or empty if an open window exists
     */
    Optional<RateWindow> startIfClosed(String phoneNumber, Instant now, Duration windowLength);
}
