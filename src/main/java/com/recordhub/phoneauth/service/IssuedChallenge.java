package com.recordhub.phoneauth.service;

import java.time.Instant;

/**
 * What a caller learns about a freshly issued challenge. Never carries the code.
 */
public record IssuedChallenge(String reference, Instant expiresAt, long expiresInSeconds) {
}
