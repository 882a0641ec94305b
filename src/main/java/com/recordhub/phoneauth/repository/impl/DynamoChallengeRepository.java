package com.recordhub.phoneauth.repository.impl;

import com.recordhub.phoneauth.model.Challenge;
import com.recordhub.phoneauth.repository.ChallengeRepository;
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

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB implementation of {@link ChallengeRepository}.
 * <p>
 * Whole-row writes go through the enhanced client; the atomic verbs are low-level
 * {@code UpdateItem} calls whose condition expressions carry the invariants, so concurrent
 * verify calls are linearized by DynamoDB itself.
 * <p>
 * Note: Bean is created by {@link com.recordhub.phoneauth.config.OtpStorageConfig}
 */
public class DynamoChallengeRepository implements ChallengeRepository {

    private static final Logger logger = LoggerFactory.getLogger(DynamoChallengeRepository.class);

    public static final String TABLE_NAME = "OtpChallenges";

    private static final Map<String, String> ATTRIBUTE_NAMES = Map.of(
            "#challengeId", "challengeId",
            "#attempts", "attemptsUsed",
            "#maxAttempts", "maxAttempts",
            "#expiresAt", "expiresAt",
            "#verified", "verified",
            "#updatedAt", "updatedAt"
    );

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<Challenge> challengeTable;
    private final TableSchema<Challenge> challengeSchema;
    private final QueryPerformanceTracker performanceTracker;

    public DynamoChallengeRepository(DynamoDbClient dynamoDbClient,
                                     DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                     QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.challengeSchema = TableSchema.fromBean(Challenge.class);
        this.challengeTable = dynamoDbEnhancedClient.table(TABLE_NAME, challengeSchema);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public void save(Challenge challenge) {
        performanceTracker.trackQuery("saveChallenge", TABLE_NAME, () -> {
            challengeTable.putItem(challenge);
            logger.debug("Saved challenge {} for phone number {}", challenge.getChallengeId(), challenge.getPhoneNumber());
            return null;
        });
    }

    @Override
    public Optional<Challenge> findByPhoneNumber(String phoneNumber) {
        return performanceTracker.trackQuery("findChallengeByPhoneNumber", TABLE_NAME, () -> {
            Key key = Key.builder()
                    .partitionValue(phoneNumber)
                    .build();
            Challenge item = challengeTable.getItem(GetItemEnhancedRequest.builder()
                    .key(key)
                    .consistentRead(true)
                    .build());
            return Optional.ofNullable(item);
        });
    }

    @Override
    public Optional<Challenge> incrementAttempts(String phoneNumber, String challengeId, Instant now) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":challengeId", AttributeValue.builder().s(challengeId).build());
        values.put(":one", AttributeValue.builder().n("1").build());
        values.put(":false", AttributeValue.builder().bool(false).build());
        values.put(":now", InstantAsLongAttributeConverter.toAttributeValue(now));

        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(keyOf(phoneNumber))
                .updateExpression("SET #attempts = #attempts + :one, #updatedAt = :now")
                .conditionExpression("#challengeId = :challengeId AND #verified = :false "
                        + "AND #attempts < #maxAttempts AND #expiresAt > :now")
                .expressionAttributeNames(namesFor("#challengeId", "#attempts", "#maxAttempts",
                        "#expiresAt", "#verified", "#updatedAt"))
                .expressionAttributeValues(values)
                .returnValues(ReturnValue.ALL_NEW)
                .build();

        return performanceTracker.trackQuery("incrementChallengeAttempts", TABLE_NAME, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                return Optional.of(challengeSchema.mapToItem(response.attributes()));
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Attempt increment refused for challenge {} ({})", challengeId, phoneNumber);
                return Optional.empty();
            }
        });
    }

    @Override
    public boolean markVerified(String phoneNumber, String challengeId, Instant now) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":challengeId", AttributeValue.builder().s(challengeId).build());
        values.put(":true", AttributeValue.builder().bool(true).build());
        values.put(":false", AttributeValue.builder().bool(false).build());
        values.put(":now", InstantAsLongAttributeConverter.toAttributeValue(now));

        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(keyOf(phoneNumber))
                .updateExpression("SET #verified = :true, #updatedAt = :now")
                .conditionExpression("#challengeId = :challengeId AND #verified = :false")
                .expressionAttributeNames(namesFor("#challengeId", "#verified", "#updatedAt"))
                .expressionAttributeValues(values)
                .build();

        return performanceTracker.trackQuery("markChallengeVerified", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(request);
                return true;
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Verified transition refused for challenge {} ({})", challengeId, phoneNumber);
                return false;
            }
        });
    }

    @Override
    public void attachDeliveryReference(String phoneNumber, String challengeId, String deliveryReference, Instant now) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":challengeId", AttributeValue.builder().s(challengeId).build());
        values.put(":reference", AttributeValue.builder().s(deliveryReference).build());
        values.put(":now", InstantAsLongAttributeConverter.toAttributeValue(now));

        Map<String, String> names = namesFor("#challengeId", "#updatedAt");
        names.put("#deliveryReference", "deliveryReference");

        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(keyOf(phoneNumber))
                .updateExpression("SET #deliveryReference = :reference, #updatedAt = :now")
                .conditionExpression("#challengeId = :challengeId")
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .build();

        performanceTracker.trackQuery("attachDeliveryReference", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(request);
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Challenge {} superseded before its delivery reference was stored", challengeId);
            }
            return null;
        });
    }

    private static Map<String, AttributeValue> keyOf(String phoneNumber) {
        return Map.of("phoneNumber", AttributeValue.builder().s(phoneNumber).build());
    }

    private static Map<String, String> namesFor(String... placeholders) {
        Map<String, String> names = new HashMap<>();
        for (String placeholder : placeholders) {
            names.put(placeholder, ATTRIBUTE_NAMES.get(placeholder));
        }
        return names;
    }
}
