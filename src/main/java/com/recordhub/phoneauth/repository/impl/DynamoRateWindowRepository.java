package com.recordhub.phoneauth.repository.impl;

import com.recordhub.phoneauth.model.RateWindow;
import com.recordhub.phoneauth.repository.RateWindowRepository;
import com.recordhub.phoneauth.util.InstantAsLongAttributeConverter;
import com.recordhub.phoneauth.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB implementation of {@link RateWindowRepository}.
 * <p>
 * The increment and the window reset are complementary condition expressions on the same
 * item ({@code windowStart > now - length} versus {@code windowStart <= now - length}), so a
 * burst of concurrent requests can never push the count past the ceiling.
 * <p>
 * Note: Bean is created by {@link com.recordhub.phoneauth.config.OtpStorageConfig}
 */
public class DynamoRateWindowRepository implements RateWindowRepository {

    private static final Logger logger = LoggerFactory.getLogger(DynamoRateWindowRepository.class);

    public static final String TABLE_NAME = "OtpRateWindows";

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<RateWindow> windowTable;
    private final TableSchema<RateWindow> windowSchema;
    private final QueryPerformanceTracker performanceTracker;

    public DynamoRateWindowRepository(DynamoDbClient dynamoDbClient,
                                      DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                      QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.windowSchema = TableSchema.fromBean(RateWindow.class);
        this.windowTable = dynamoDbEnhancedClient.table(TABLE_NAME, windowSchema);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<RateWindow> findByPhoneNumber(String phoneNumber) {
        return performanceTracker.trackQuery("findRateWindow", TABLE_NAME, () -> {
            RateWindow item = windowTable.getItem(GetItemEnhancedRequest.builder()
                    .key(Key.builder().partitionValue(phoneNumber).build())
                    .consistentRead(true)
                    .build());
            return Optional.ofNullable(item);
        });
    }

    @Override
    public Optional<RateWindow> incrementIfOpen(String phoneNumber, Instant now, Duration windowLength, int maxRequests) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":one", AttributeValue.builder().n("1").build());
        values.put(":cutoff", InstantAsLongAttributeConverter.toAttributeValue(now.minus(windowLength)));
        values.put(":max", AttributeValue.builder().n(String.valueOf(maxRequests)).build());

        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(keyOf(phoneNumber))
                .updateExpression("SET #count = #count + :one")
                .conditionExpression("attribute_exists(#phone) AND #windowStart > :cutoff AND #count < :max")
                .expressionAttributeNames(Map.of(
                        "#phone", "phoneNumber",
                        "#windowStart", "windowStart",
                        "#count", "requestCount"))
                .expressionAttributeValues(values)
                .returnValues(ReturnValue.ALL_NEW)
                .build();

        return performanceTracker.trackQuery("incrementRateWindow", TABLE_NAME, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                return Optional.of(windowSchema.mapToItem(response.attributes()));
            } catch (ConditionalCheckFailedException e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<RateWindow> startIfClosed(String phoneNumber, Instant now, Duration windowLength) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":one", AttributeValue.builder().n("1").build());
        values.put(":now", InstantAsLongAttributeConverter.toAttributeValue(now));
        values.put(":cutoff", InstantAsLongAttributeConverter.toAttributeValue(now.minus(windowLength)));
        values.put(":ttl", AttributeValue.builder()
                .n(String.valueOf(now.plus(windowLength.multipliedBy(2)).getEpochSecond()))
                .build());

        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(keyOf(phoneNumber))
                .updateExpression("SET #windowStart = :now, #count = :one, #ttl = :ttl")
                .conditionExpression("attribute_not_exists(#phone) OR #windowStart <= :cutoff")
                .expressionAttributeNames(Map.of(
                        "#phone", "phoneNumber",
                        "#windowStart", "windowStart",
                        "#count", "requestCount",
                        "#ttl", "ttl"))
                .expressionAttributeValues(values)
                .returnValues(ReturnValue.ALL_NEW)
                .build();

        return performanceTracker.trackQuery("startRateWindow", TABLE_NAME, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                logger.debug("Started new rate window for phone number {}", phoneNumber);
                return Optional.of(windowSchema.mapToItem(response.attributes()));
            } catch (ConditionalCheckFailedException e) {
                return Optional.empty();
            }
        });
    }

    private static Map<String, AttributeValue> keyOf(String phoneNumber) {
        return Map.of("phoneNumber", AttributeValue.builder().s(phoneNumber).build());
    }
}
