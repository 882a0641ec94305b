package com.recordhub.phoneauth.model;

import java.time.Instant;

/**
 * Lifecycle of a {@link Challenge}. Only {@link #PENDING} accepts verify attempts;
 * the other states are terminal.
 */
public enum ChallengeState {
    PENDING,
    VERIFIED,
    EXPIRED,
    EXHAUSTED;

    /**
     * Derives the state from the stored fields and the server clock.
     */
    public static ChallengeState of(Challenge challenge, Instant now) {
        if (Boolean.TRUE.equals(challenge.getVerified())) {
            return VERIFIED;
        }
        if (challenge.getAttemptsUsed() >= challenge.getMaxAttempts()) {
            return EXHAUSTED;
        }
        if (!now.isBefore(challenge.getExpiresAt())) {
            return EXPIRED;
        }
        return PENDING;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
