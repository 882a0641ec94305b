package com.recordhub.phoneauth.repository;

import com.recordhub.phoneauth.model.Challenge;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for OTP challenges, one active row per phone number.
 * <p>
 * Mutations other than {@link #save(Challenge)} are single conditional updates guarded by the
 * challenge id, so a challenge that has been superseded by a newer issuance is never touched.
 */
public interface ChallengeRepository {

    /**
     * Writes a freshly issued challenge, replacing whatever challenge the phone number had.
     */
    void save(Challenge challenge);

    Optional<Challenge> findByPhoneNumber(String phoneNumber);

    /**
     * Atomically consumes one attempt if the challenge is still the active one, unverified,
     * unexpired at {@code now} and has attempts left.
     *
     * @return the challenge after the increment, or empty if any of the conditions failed
     */
    Optional<Challenge> incrementAttempts(String phoneNumber, String challengeId, Instant now);

    /**
     * Atomically flips {@code verified} from false to true for the given challenge.
     *
     * @return true for exactly one caller per challenge
     */
    boolean markVerified(String phoneNumber, String challengeId, Instant now);

    /**
     * Records the SMS provider reference. Ignored if the challenge was superseded meanwhile.
     */
    void attachDeliveryReference(String phoneNumber, String challengeId, String deliveryReference, Instant now);
}
