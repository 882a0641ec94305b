package com.recordhub.phoneauth.model;

import com.recordhub.phoneauth.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One issued OTP and its verification state.
 * <p>
 * Stored as a single row per phone number. Issuing a new challenge overwrites the row,
 * and every conditional update is keyed on {@link #getChallengeId()}, so a superseded
 * challenge can no longer be mutated or verified. The digest is never updated in place.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class Challenge {

    private String phoneNumber;
    private String challengeId;
    private String secretDigest;
    private Integer attemptsUsed;
    private Integer maxAttempts;
    private Instant expiresAt;
    private Boolean verified;
    private String deliveryReference;
    private Instant createdAt;
    private Instant updatedAt;
    // epoch seconds, reaped by the table TTL
    private Long ttl;

    public Challenge(String phoneNumber, String secretDigest, int maxAttempts, Instant now, Duration validity,
                     Duration retention) {
        this.phoneNumber = phoneNumber;
        this.challengeId = UUID.randomUUID().toString();
        this.secretDigest = secretDigest;
        this.attemptsUsed = 0;
        this.maxAttempts = maxAttempts;
        this.expiresAt = now.plus(validity);
        this.verified = false;
        this.createdAt = now;
        this.updatedAt = now;
        this.ttl = expiresAt.plus(retention).getEpochSecond();
    }

    @DynamoDbPartitionKey
    public String getPhoneNumber() {
        return phoneNumber;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public ChallengeState stateAt(Instant now) {
        return ChallengeState.of(this, now);
    }

    public int attemptsRemaining() {
        return Math.max(0, maxAttempts - attemptsUsed);
    }

    @Override
    public String toString() {
        return "Challenge{" +
                "phoneNumber='" + phoneNumber + '\'' +
                ", challengeId='" + challengeId + '\'' +
                ", secretDigest='[REDACTED]'" +
                ", attemptsUsed=" + attemptsUsed +
                ", maxAttempts=" + maxAttempts +
                ", expiresAt=" + expiresAt +
                ", verified=" + verified +
                ", deliveryReference='" + deliveryReference + '\'' +
                '}';
    }
}
