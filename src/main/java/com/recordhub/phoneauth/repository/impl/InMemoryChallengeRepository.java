package com.recordhub.phoneauth.repository.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.recordhub.phoneauth.model.Challenge;
import com.recordhub.phoneauth.repository.ChallengeRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caffeine backed {@link ChallengeRepository} for single-instance deployments and local runs.
 * <p>
 * Conditional updates run inside {@code asMap().compute}, which is atomic per key. Stored
 * challenges are copied on the way in and out so callers never share the cached instance.
 */
public class InMemoryChallengeRepository implements ChallengeRepository {

    private final Cache<String, Challenge> challenges;

    public InMemoryChallengeRepository(Duration retention) {
        this.challenges = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(100_000)
                .build();
    }

    @Override
    public void save(Challenge challenge) {
        challenges.put(challenge.getPhoneNumber(), copyOf(challenge));
    }

    @Override
    public Optional<Challenge> findByPhoneNumber(String phoneNumber) {
        return Optional.ofNullable(challenges.getIfPresent(phoneNumber)).map(InMemoryChallengeRepository::copyOf);
    }

    @Override
    public Optional<Challenge> incrementAttempts(String phoneNumber, String challengeId, Instant now) {
        AtomicReference<Challenge> updated = new AtomicReference<>();
        challenges.asMap().computeIfPresent(phoneNumber, (key, current) -> {
            boolean pending = current.getChallengeId().equals(challengeId)
                    && !Boolean.TRUE.equals(current.getVerified())
                    && current.getAttemptsUsed() < current.getMaxAttempts()
                    && current.getExpiresAt().isAfter(now);
            if (!pending) {
                return current;
            }
            Challenge next = copyOf(current);
            next.setAttemptsUsed(current.getAttemptsUsed() + 1);
            next.setUpdatedAt(now);
            updated.set(copyOf(next));
            return next;
        });
        return Optional.ofNullable(updated.get());
    }

    @Override
    public boolean markVerified(String phoneNumber, String challengeId, Instant now) {
        AtomicBoolean transitioned = new AtomicBoolean(false);
        challenges.asMap().computeIfPresent(phoneNumber, (key, current) -> {
            if (!current.getChallengeId().equals(challengeId) || Boolean.TRUE.equals(current.getVerified())) {
                return current;
            }
            Challenge next = copyOf(current);
            next.setVerified(true);
            next.setUpdatedAt(now);
            transitioned.set(true);
            return next;
        });
        return transitioned.get();
    }

    @Override
    public void attachDeliveryReference(String phoneNumber, String challengeId, String deliveryReference, Instant now) {
        challenges.asMap().computeIfPresent(phoneNumber, (key, current) -> {
            if (!current.getChallengeId().equals(challengeId)) {
                return current;
            }
            Challenge next = copyOf(current);
            next.setDeliveryReference(deliveryReference);
            next.setUpdatedAt(now);
            return next;
        });
    }

    private static Challenge copyOf(Challenge source) {
        Challenge copy = new Challenge();
        copy.setPhoneNumber(source.getPhoneNumber());
        copy.setChallengeId(source.getChallengeId());
        copy.setSecretDigest(source.getSecretDigest());
        copy.setAttemptsUsed(source.getAttemptsUsed());
        copy.setMaxAttempts(source.getMaxAttempts());
        copy.setExpiresAt(source.getExpiresAt());
        copy.setVerified(source.getVerified());
        copy.setDeliveryReference(source.getDeliveryReference());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        copy.setTtl(source.getTtl());
        return copy;
    }
}
