package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.config.OtpProperties;
import com.recordhub.phoneauth.exception.DeliveryFailedException;
import com.recordhub.phoneauth.exception.InvalidOrExpiredCodeException;
import com.recordhub.phoneauth.exception.MaxAttemptsExceededException;
import com.recordhub.phoneauth.exception.RateLimitedException;
import com.recordhub.phoneauth.exception.RepositoryException;
import com.recordhub.phoneauth.model.Challenge;
import com.recordhub.phoneauth.model.ChallengeState;
import com.recordhub.phoneauth.model.User;
import com.recordhub.phoneauth.repository.ChallengeRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and verifies OTP challenges.
 * <p>
 * Issue flow: rate limit, generate, digest, persist (superseding any earlier challenge for the
 * number), send. Verify flow: load, check state, atomically consume an attempt, compare digests,
 * atomically mark verified, then provision the user and mint a session.
 * <p>
 * The plaintext code only lives on the stack between generation and the SMS hand-off. It is never
 * stored or logged.
 */
@Service
public class VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(VerificationEngine.class);

    private final ChallengeRepository challengeRepository;
    private final RateLimiter rateLimiter;
    private final CodeGenerator codeGenerator;
    private final SecretHasher secretHasher;
    private final SmsGateway smsGateway;
    private final UserProvisioner userProvisioner;
    private final SessionIssuer sessionIssuer;
    private final OtpProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public VerificationEngine(ChallengeRepository challengeRepository,
                              RateLimiter rateLimiter,
                              CodeGenerator codeGenerator,
                              SecretHasher secretHasher,
                              SmsGateway smsGateway,
                              UserProvisioner userProvisioner,
                              SessionIssuer sessionIssuer,
                              OtpProperties properties,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.challengeRepository = challengeRepository;
        this.rateLimiter = rateLimiter;
        this.codeGenerator = codeGenerator;
        this.secretHasher = secretHasher;
        this.smsGateway = smsGateway;
        this.userProvisioner = userProvisioner;
        this.sessionIssuer = sessionIssuer;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Issues a new challenge and sends its code by SMS.
     *
     * @throws RateLimitedException if the phone number has used its send budget for the window
     * @throws DeliveryFailedException if the SMS could not be sent; the challenge stays valid
     */
    public IssuedChallenge issue(String phoneNumber) {
        return send(phoneNumber, "issue");
    }

    /**
     * Replaces any challenge for the phone number with a new one. Shares the rate limit budget with
     * {@link #issue(String)}.
     */
    public IssuedChallenge resend(String phoneNumber) {
        return send(phoneNumber, "resend");
    }

    /**
     * Verifies a submitted code and, on success, returns a session for the phone number's user.
     *
     * @throws InvalidOrExpiredCodeException for a wrong code or a missing, expired, superseded or used challenge
     * @throws MaxAttemptsExceededException when this attempt spent the last one or none were left
     */
    public SessionGrant verify(String phoneNumber, String submittedCode) {
        Instant now = clock.instant();

        Optional<Challenge> loaded = challengeRepository.findByPhoneNumber(phoneNumber);
        if (loaded.isEmpty()) {
            logger.info("No challenge found for phone number: {}", phoneNumber);
            recordVerifyOutcome("no_challenge");
            throw new InvalidOrExpiredCodeException();
        }

        Challenge challenge = loaded.get();
        ChallengeState state = challenge.stateAt(now);
        if (state.isTerminal()) {
            logger.info("Challenge {} for {} is {}, rejecting verify", challenge.getChallengeId(), phoneNumber, state);
            recordVerifyOutcome(state.name().toLowerCase());
            throw new InvalidOrExpiredCodeException();
        }

        Optional<Challenge> counted = challengeRepository.incrementAttempts(phoneNumber, challenge.getChallengeId(), now);
        if (counted.isEmpty()) {
            throw refusedAttempt(phoneNumber, challenge.getChallengeId(), now);
        }

        Challenge afterAttempt = counted.get();
        if (!secretHasher.matches(phoneNumber, submittedCode, afterAttempt.getSecretDigest())) {
            if (afterAttempt.attemptsRemaining() == 0) {
                logger.info("Last attempt failed for challenge {} ({}), challenge exhausted",
                        afterAttempt.getChallengeId(), phoneNumber);
                recordVerifyOutcome("exhausted");
                throw new MaxAttemptsExceededException();
            }
            logger.info("Invalid code for {}, attempts used: {}/{}",
                    phoneNumber, afterAttempt.getAttemptsUsed(), afterAttempt.getMaxAttempts());
            recordVerifyOutcome("mismatch");
            throw new InvalidOrExpiredCodeException();
        }

        if (!challengeRepository.markVerified(phoneNumber, afterAttempt.getChallengeId(), now)) {
            logger.info("Challenge {} for {} was verified or superseded concurrently",
                    afterAttempt.getChallengeId(), phoneNumber);
            recordVerifyOutcome("lost_race");
            throw new InvalidOrExpiredCodeException();
        }

        User user = userProvisioner.provision(phoneNumber);
        String userId = user.getId().toString();
        String token = sessionIssuer.issue(userId);

        logger.info("Phone number {} verified, session issued for user {}", phoneNumber, userId);
        recordVerifyOutcome("success");
        return new SessionGrant(token, userId, phoneNumber, sessionIssuer.getAccessTokenExpirationSeconds());
    }

    /**
     * Describes the current challenge without consuming attempts or rate limit budget.
     */
    public ChallengeStatus status(String phoneNumber) {
        Instant now = clock.instant();
        boolean canResend = rateLimiter.wouldAllow(phoneNumber);

        return challengeRepository.findByPhoneNumber(phoneNumber)
                .filter(challenge -> challenge.stateAt(now) == ChallengeState.PENDING)
                .map(challenge -> new ChallengeStatus(true, challenge.attemptsRemaining(),
                        challenge.getExpiresAt(), canResend))
                .orElseGet(() -> new ChallengeStatus(false, 0, null, canResend));
    }

    private IssuedChallenge send(String phoneNumber, String kind) {
        RateLimitDecision decision = rateLimiter.checkAndConsume(phoneNumber);
        if (!decision.allowed()) {
            throw new RateLimitedException(decision.retryAfter());
        }

        Instant now = clock.instant();
        Duration ttl = properties.getTtl();
        String code = codeGenerator.generate();
        Challenge challenge = new Challenge(phoneNumber, secretHasher.digest(phoneNumber, code),
                properties.getMaxAttempts(), now, ttl, properties.getStorage().getRetention());

        challengeRepository.save(challenge);
        logger.info("Challenge {} saved for phone number: {} ({})", challenge.getChallengeId(), phoneNumber, kind);

        String deliveryReference;
        try {
            deliveryReference = smsGateway.send(phoneNumber, renderMessage(code, ttl));
        } catch (DeliveryFailedException e) {
            meterRegistry.counter("otp.delivery_failed").increment();
            throw e;
        } catch (RuntimeException e) {
            meterRegistry.counter("otp.delivery_failed").increment();
            throw new DeliveryFailedException("Failed to send verification SMS", e);
        }

        try {
            challengeRepository.attachDeliveryReference(phoneNumber, challenge.getChallengeId(),
                    deliveryReference, clock.instant());
        } catch (RepositoryException e) {
            // The code is already on its way, so the caller still gets a usable challenge
            logger.warn("Could not record delivery reference {} for challenge {}: {}",
                    deliveryReference, challenge.getChallengeId(), e.getMessage());
        }

        meterRegistry.counter("otp.issued", "kind", kind).increment();
        return new IssuedChallenge(challenge.getChallengeId(), challenge.getExpiresAt(), ttl.getSeconds());
    }

    private RuntimeException refusedAttempt(String phoneNumber, String challengeId, Instant now) {
        Optional<Challenge> current = challengeRepository.findByPhoneNumber(phoneNumber);
        boolean exhausted = current.isPresent()
                && current.get().getChallengeId().equals(challengeId)
                && current.get().stateAt(now) == ChallengeState.EXHAUSTED;
        if (exhausted) {
            logger.info("Attempt budget spent for challenge {} ({})", challengeId, phoneNumber);
            recordVerifyOutcome("exhausted");
            return new MaxAttemptsExceededException();
        }
        logger.info("Attempt refused for challenge {} ({}), no longer pending", challengeId, phoneNumber);
        recordVerifyOutcome("refused");
        return new InvalidOrExpiredCodeException();
    }

    String renderMessage(String code, Duration ttl) {
        long minutes = Math.max(1, (ttl.getSeconds() + 59) / 60);
        return properties.getSms().getTemplate()
                .replace("{code}", code)
                .replace("{minutes}", String.valueOf(minutes));
    }

    private void recordVerifyOutcome(String outcome) {
        meterRegistry.counter("otp.verify", "outcome", outcome).increment();
    }
}
