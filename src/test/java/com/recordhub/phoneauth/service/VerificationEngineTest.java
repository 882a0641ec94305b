package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.config.OtpProperties;
import com.recordhub.phoneauth.exception.DeliveryFailedException;
import com.recordhub.phoneauth.exception.InvalidOrExpiredCodeException;
import com.recordhub.phoneauth.exception.MaxAttemptsExceededException;
import com.recordhub.phoneauth.exception.RateLimitedException;
import com.recordhub.phoneauth.model.Challenge;
import com.recordhub.phoneauth.model.ChallengeState;
import com.recordhub.phoneauth.model.User;
import com.recordhub.phoneauth.repository.impl.InMemoryChallengeRepository;
import com.recordhub.phoneauth.repository.impl.InMemoryRateWindowRepository;
import com.recordhub.phoneauth.testutil.MutableClock;
import com.recordhub.phoneauth.testutil.RecordingSmsGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the issue/verify/resend state machine against the in-memory stores.
 * <p>
 * The SMS gateway records messages, user provisioning and session issuing are mocked, and the
 * clock only moves when a test advances it.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationEngine Tests")
class VerificationEngineTest {

    private static final String PHONE = "+15551234567";

    @Mock
    private CodeGenerator codeGenerator;

    @Mock
    private UserProvisioner userProvisioner;

    @Mock
    private SessionIssuer sessionIssuer;

    private MutableClock clock;
    private OtpProperties properties;
    private InMemoryChallengeRepository challengeRepository;
    private RecordingSmsGateway smsGateway;
    private SimpleMeterRegistry meterRegistry;
    private SecretHasher secretHasher;
    private User user;
    private VerificationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new OtpProperties();
        challengeRepository = new InMemoryChallengeRepository(Duration.ofDays(1));
        smsGateway = new RecordingSmsGateway();
        meterRegistry = new SimpleMeterRegistry();
        secretHasher = new SecretHasher(properties);
        RateLimiter rateLimiter = new RateLimiter(new InMemoryRateWindowRepository(Duration.ofMinutes(2)),
                properties, clock, meterRegistry);

        user = new User(PHONE, clock.instant());
        lenient().when(userProvisioner.provision(PHONE)).thenReturn(user);
        lenient().when(sessionIssuer.issue(anyString())).thenReturn("session-token");
        lenient().when(sessionIssuer.getAccessTokenExpirationSeconds()).thenReturn(1800);

        engine = new VerificationEngine(challengeRepository, rateLimiter, codeGenerator, secretHasher, smsGateway,
                userProvisioner, sessionIssuer, properties, clock, meterRegistry);
    }

    @Nested
    @DisplayName("issue")
    class Issue {

        @Test
        void persistsDigestAndSendsCodeOnce() {
            when(codeGenerator.generate()).thenReturn("482913");

            IssuedChallenge issued = engine.issue(PHONE);

            Challenge stored = challengeRepository.findByPhoneNumber(PHONE).orElseThrow();
            assertThat(issued.reference()).isEqualTo(stored.getChallengeId());
            assertThat(issued.expiresInSeconds()).isEqualTo(300);
            assertThat(issued.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
            assertThat(stored.stateAt(clock.instant())).isEqualTo(ChallengeState.PENDING);
            assertThat(stored.getAttemptsUsed()).isZero();
            assertThat(stored.getMaxAttempts()).isEqualTo(3);
            assertThat(stored.getSecretDigest()).doesNotContain("482913");
            assertThat(secretHasher.matches(PHONE, "482913", stored.getSecretDigest())).isTrue();
            assertThat(stored.getDeliveryReference()).isEqualTo("msg-1");

            assertThat(smsGateway.getSent()).hasSize(1);
            assertThat(smsGateway.lastMessage().phoneNumber()).isEqualTo(PHONE);
            assertThat(smsGateway.lastMessage().message())
                    .isEqualTo("Your verification code is 482913. It expires in 5 minutes. Do not share it.");
            assertThat(meterRegistry.counter("otp.issued", "kind", "issue").count()).isEqualTo(1.0);
        }

        @Test
        void referenceNeverContainsTheCode() {
            when(codeGenerator.generate()).thenReturn("482913");

            assertThat(engine.issue(PHONE).reference()).doesNotContain("482913");
        }

        @Test
        @DisplayName("ceiling + 1 issues: the last one is rate limited with a positive retry-after")
        void rateLimitsBeyondCeiling() {
            when(codeGenerator.generate()).thenReturn("111111", "222222", "333333");
            engine.issue(PHONE);
            engine.issue(PHONE);
            engine.issue(PHONE);

            Throwable thrown = catchThrowable(() -> engine.issue(PHONE));

            assertThat(thrown).isInstanceOf(RateLimitedException.class);
            RateLimitedException limited = (RateLimitedException) thrown;
            assertThat(limited.getRetryAfter()).isPositive();
            assertThat(limited.getRetryAfterSeconds()).isEqualTo(60);
            assertThat(smsGateway.getSent()).hasSize(3);
            verify(codeGenerator, times(3)).generate();
        }

        @Test
        @DisplayName("A failed SMS leaves a valid challenge behind")
        void deliveryFailureKeepsChallengeValid() {
            when(codeGenerator.generate()).thenReturn("482913");
            smsGateway.failWith(new DeliveryFailedException("provider down", null));

            assertThatThrownBy(() -> engine.issue(PHONE)).isInstanceOf(DeliveryFailedException.class);
            assertThat(meterRegistry.counter("otp.delivery_failed").count()).isEqualTo(1.0);

            SessionGrant grant = engine.verify(PHONE, "482913");
            assertThat(grant.sessionToken()).isEqualTo("session-token");
        }

        @Test
        void unexpectedGatewayErrorsBecomeDeliveryFailed() {
            when(codeGenerator.generate()).thenReturn("482913");
            smsGateway.failWith(SdkClientException.create("network unreachable"));

            assertThatThrownBy(() -> engine.issue(PHONE))
                    .isInstanceOf(DeliveryFailedException.class)
                    .hasCauseInstanceOf(SdkClientException.class);
        }

        @Test
        void rendersMinutesRoundedUp() {
            assertThat(engine.renderMessage("123456", Duration.ofSeconds(90)))
                    .isEqualTo("Your verification code is 123456. It expires in 2 minutes. Do not share it.");
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("Correct code succeeds exactly once")
        void succeedsOnceThenFailsOnReplay() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);

            SessionGrant grant = engine.verify(PHONE, "482913");

            assertThat(grant.sessionToken()).isEqualTo("session-token");
            assertThat(grant.userId()).isEqualTo(user.getId().toString());
            assertThat(grant.phoneNumber()).isEqualTo(PHONE);
            assertThat(grant.expiresInSeconds()).isEqualTo(1800);
            assertThat(challengeRepository.findByPhoneNumber(PHONE).orElseThrow().getVerified()).isTrue();

            assertThatThrownBy(() -> engine.verify(PHONE, "482913"))
                    .isInstanceOf(InvalidOrExpiredCodeException.class);
            verify(sessionIssuer, times(1)).issue(user.getId().toString());
        }

        @Test
        void wrongCodeConsumesAnAttempt() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);

            assertThatThrownBy(() -> engine.verify(PHONE, "000000"))
                    .isInstanceOf(InvalidOrExpiredCodeException.class)
                    .hasMessage(InvalidOrExpiredCodeException.MESSAGE);

            assertThat(challengeRepository.findByPhoneNumber(PHONE).orElseThrow().getAttemptsUsed()).isEqualTo(1);
            verify(userProvisioner, never()).provision(anyString());
        }

        @Test
        @DisplayName("Third wrong attempt exhausts the challenge; the correct code then fails too")
        void exhaustsAfterMaxAttempts() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);

            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(MaxAttemptsExceededException.class);

            Challenge exhausted = challengeRepository.findByPhoneNumber(PHONE).orElseThrow();
            assertThat(exhausted.stateAt(clock.instant())).isEqualTo(ChallengeState.EXHAUSTED);
            assertThat(exhausted.getAttemptsUsed()).isEqualTo(3);

            assertThatThrownBy(() -> engine.verify(PHONE, "482913")).isInstanceOf(RuntimeException.class);
            assertThat(challengeRepository.findByPhoneNumber(PHONE).orElseThrow().getAttemptsUsed()).isEqualTo(3);
            verify(sessionIssuer, never()).issue(anyString());
        }

        @Test
        @DisplayName("Expired challenge rejects the correct code without counting an attempt")
        void rejectsAfterTtl() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);
            clock.advance(Duration.ofMinutes(5));

            assertThatThrownBy(() -> engine.verify(PHONE, "482913"))
                    .isInstanceOf(InvalidOrExpiredCodeException.class);

            assertThat(challengeRepository.findByPhoneNumber(PHONE).orElseThrow().getAttemptsUsed()).isZero();
        }

        @Test
        void missingChallengeLooksLikeAWrongCode() {
            assertThatThrownBy(() -> engine.verify(PHONE, "482913"))
                    .isInstanceOf(InvalidOrExpiredCodeException.class)
                    .hasMessage(InvalidOrExpiredCodeException.MESSAGE);
        }

        @Test
        @DisplayName("N parallel correct verifications produce exactly one session")
        void parallelVerifiesSucceedOnce() throws Exception {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);

            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        engine.verify(PHONE, "482913");
                        return true;
                    } catch (InvalidOrExpiredCodeException | MaxAttemptsExceededException e) {
                        return false;
                    }
                };
                for (int i = 0; i < threads; i++) {
                    results.add(executor.submit(attempt));
                }
                start.countDown();

                int successes = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        successes++;
                    }
                }
                assertThat(successes).isEqualTo(1);
                verify(sessionIssuer, times(1)).issue(anyString());
                verify(userProvisioner, times(1)).provision(PHONE);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("resend")
    class Resend {

        @Test
        @DisplayName("Only the newest code verifies")
        void supersedesPreviousChallenge() {
            when(codeGenerator.generate()).thenReturn("111111", "222222");
            IssuedChallenge first = engine.issue(PHONE);
            IssuedChallenge second = engine.resend(PHONE);

            assertThat(second.reference()).isNotEqualTo(first.reference());
            assertThatThrownBy(() -> engine.verify(PHONE, "111111"))
                    .isInstanceOf(InvalidOrExpiredCodeException.class);

            SessionGrant grant = engine.verify(PHONE, "222222");

            assertThat(grant.sessionToken()).isEqualTo("session-token");
            assertThat(meterRegistry.counter("otp.issued", "kind", "resend").count()).isEqualTo(1.0);
        }

        @Test
        void sharesTheRateLimitBudgetWithIssue() {
            when(codeGenerator.generate()).thenReturn("111111", "222222", "333333");
            engine.issue(PHONE);
            engine.resend(PHONE);
            engine.resend(PHONE);

            assertThatThrownBy(() -> engine.resend(PHONE)).isInstanceOf(RateLimitedException.class);
        }

        @Test
        void startsFreshAttemptBudget() {
            when(codeGenerator.generate()).thenReturn("111111", "222222");
            engine.issue(PHONE);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);

            engine.resend(PHONE);

            assertThat(challengeRepository.findByPhoneNumber(PHONE).orElseThrow().attemptsRemaining()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        void reportsNothingPendingForUnknownNumber() {
            ChallengeStatus status = engine.status(PHONE);

            assertThat(status.pending()).isFalse();
            assertThat(status.attemptsRemaining()).isZero();
            assertThat(status.expiresAt()).isNull();
            assertThat(status.canResend()).isTrue();
        }

        @Test
        void reportsPendingChallengeWithoutConsumingAnything() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);

            ChallengeStatus status = engine.status(PHONE);
            engine.status(PHONE);

            assertThat(status.pending()).isTrue();
            assertThat(status.attemptsRemaining()).isEqualTo(2);
            assertThat(status.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
            assertThat(status.canResend()).isTrue();
            assertThat(challengeRepository.findByPhoneNumber(PHONE).orElseThrow().getAttemptsUsed()).isEqualTo(1);
        }

        @Test
        void reportsResendBlockedAtCeiling() {
            when(codeGenerator.generate()).thenReturn("111111", "222222", "333333");
            engine.issue(PHONE);
            engine.resend(PHONE);
            engine.resend(PHONE);

            assertThat(engine.status(PHONE).canResend()).isFalse();
        }

        @Test
        void verifiedChallengeIsNotPending() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);
            engine.verify(PHONE, "482913");

            assertThat(engine.status(PHONE).pending()).isFalse();
        }
    }

    @Nested
    @DisplayName("End-to-end scenarios")
    class EndToEnd {

        @Test
        void issueVerifyThenReplay() {
            when(codeGenerator.generate()).thenReturn("482913");

            engine.issue("+15551234567");
            assertThat(smsGateway.getSent()).hasSize(1);
            assertThat(smsGateway.lastMessage().message()).contains("482913");

            assertThat(engine.verify("+15551234567", "482913").sessionToken()).isEqualTo("session-token");
            assertThatThrownBy(() -> engine.verify("+15551234567", "482913"))
                    .isInstanceOf(InvalidOrExpiredCodeException.class);
        }

        @Test
        void threeWrongCodesThenCorrectCode() {
            when(codeGenerator.generate()).thenReturn("482913");
            engine.issue(PHONE);

            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(InvalidOrExpiredCodeException.class);
            assertThatThrownBy(() -> engine.verify(PHONE, "000000")).isInstanceOf(MaxAttemptsExceededException.class);
            assertThatThrownBy(() -> engine.verify(PHONE, "482913"))
                    .isInstanceOfAny(InvalidOrExpiredCodeException.class, MaxAttemptsExceededException.class);
            verify(sessionIssuer, never()).issue(anyString());
        }
    }
}
