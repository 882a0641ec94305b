package com.recordhub.phoneauth.model;

import com.recordhub.phoneauth.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request counter for one phone number, independent of challenge state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class RateWindow {

    private String phoneNumber;
    private Instant windowStart;
    private Integer requestCount;
    private Long ttl;

    @DynamoDbPartitionKey
    public String getPhoneNumber() {
        return phoneNumber;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant windowEnd(Duration windowLength) {
        return windowStart.plus(windowLength);
    }

    public boolean isOpenAt(Instant now, Duration windowLength) {
        return now.isBefore(windowEnd(windowLength));
    }
}
