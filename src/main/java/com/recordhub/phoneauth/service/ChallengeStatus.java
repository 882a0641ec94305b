package com.recordhub.phoneauth.service;

import java.time.Instant;

/**
 * Read-only view of the OTP state of a phone number. {@code expiresAt} is null when nothing is pending.
 */
public record ChallengeStatus(boolean pending, int attemptsRemaining, Instant expiresAt, boolean canResend) {
}
