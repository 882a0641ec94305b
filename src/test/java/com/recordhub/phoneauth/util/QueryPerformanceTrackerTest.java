package com.recordhub.phoneauth.util;

import com.recordhub.phoneauth.exception.RepositoryException;
import com.recordhub.phoneauth.exception.StorageTimeoutException;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryPerformanceTrackerTest {

    private SimpleMeterRegistry meterRegistry;
    private QueryPerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tracker = new QueryPerformanceTracker(meterRegistry);
    }

    @Test
    void trackQuery_returnsResultAndRecordsTimer() {
        String result = tracker.trackQuery("findChallenge", "OtpChallenges", () -> "value");

        assertThat(result).isEqualTo("value");
        Timer timer = meterRegistry.find("dynamodb.query.duration")
                .tag("operation", "findChallenge")
                .tag("table", "OtpChallenges")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    void trackQuery_passesConditionalFailuresThrough() {
        ConditionalCheckFailedException failure = ConditionalCheckFailedException.builder().message("condition").build();

        assertThatThrownBy(() -> tracker.trackQuery("markVerified", "OtpChallenges", () -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void trackQuery_translatesTimeouts() {
        assertThatThrownBy(() -> tracker.trackQuery("findChallenge", "OtpChallenges", () -> {
            throw ApiCallAttemptTimeoutException.builder().message("slow").build();
        })).isInstanceOf(StorageTimeoutException.class)
                .hasMessageContaining("findChallenge");
    }

    @Test
    void trackQuery_translatesServiceAndClientFailures() {
        assertThatThrownBy(() -> tracker.trackQuery("save", "OtpChallenges", () -> {
            throw DynamoDbException.builder().message("throttled").build();
        })).isInstanceOf(RepositoryException.class)
                .isNotInstanceOf(StorageTimeoutException.class);

        assertThatThrownBy(() -> tracker.trackQuery("save", "OtpChallenges", () -> {
            throw SdkClientException.create("connection refused");
        })).isInstanceOf(RepositoryException.class);

        assertThat(meterRegistry.find("dynamodb.query.duration").tag("operation", "save").timer().count())
                .isEqualTo(2);
    }
}
