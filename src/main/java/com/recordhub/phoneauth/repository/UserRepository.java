package com.recordhub.phoneauth.repository;

import com.recordhub.phoneauth.model.PhoneNumberClaim;
import com.recordhub.phoneauth.model.User;
import com.recordhub.phoneauth.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Users table plus the phone number claims that make phone to user resolution unique.
 * <p>
 * Lookups by phone number read the claim with a consistent read, so a user created a moment
 * ago is always found by the next sign-in.
 */
@Repository
public class UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserRepository.class);

    public static final String TABLE_NAME = "Users";
    public static final String CLAIM_TABLE_NAME = "UserPhoneNumbers";

    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<User> userSchema;
    private final TableSchema<PhoneNumberClaim> claimSchema;
    private final DynamoDbTable<User> userTable;
    private final DynamoDbTable<PhoneNumberClaim> claimTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public UserRepository(DynamoDbClient dynamoDbClient,
                          DynamoDbEnhancedClient dynamoDbEnhancedClient,
                          QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.userSchema = TableSchema.fromBean(User.class);
        this.claimSchema = TableSchema.fromBean(PhoneNumberClaim.class);
        this.userTable = dynamoDbEnhancedClient.table(TABLE_NAME, userSchema);
        this.claimTable = dynamoDbEnhancedClient.table(CLAIM_TABLE_NAME, claimSchema);
        this.performanceTracker = performanceTracker;
    }

    /**
     * Overwrites an existing user row. New users go through {@link #createWithPhoneNumberClaim}.
     */
    public User save(User user) {
        return performanceTracker.trackQuery("saveUser", TABLE_NAME, () -> {
            userTable.putItem(user);
            return user;
        });
    }

    public Optional<User> findById(UUID id) {
        return performanceTracker.trackQuery("findUserById", TABLE_NAME,
                () -> Optional.ofNullable(userTable.getItem(consistentGet(id.toString()))));
    }

    public Optional<User> findByPhoneNumber(String phoneNumber) {
        Optional<PhoneNumberClaim> claim = performanceTracker.trackQuery("findPhoneNumberClaim", CLAIM_TABLE_NAME,
                () -> Optional.ofNullable(claimTable.getItem(consistentGet(phoneNumber))));
        if (claim.isEmpty()) {
            return Optional.empty();
        }
        return findById(UUID.fromString(claim.get().getUserId()));
    }

    /**
     * Writes the user and its phone number claim atomically.
     *
     * @return false if the phone number is already claimed; nothing is written in that case
     */
    public boolean createWithPhoneNumberClaim(User user, Instant now) {
        PhoneNumberClaim claim = new PhoneNumberClaim(user.getPhoneNumber(), user.getId().toString(), now);

        TransactWriteItemsRequest request = TransactWriteItemsRequest.builder()
                .transactItems(
                        TransactWriteItem.builder()
                                .put(Put.builder()
                                        .tableName(CLAIM_TABLE_NAME)
                                        .item(claimSchema.itemToMap(claim, true))
                                        .conditionExpression("attribute_not_exists(phoneNumber)")
                                        .build())
                                .build(),
                        TransactWriteItem.builder()
                                .put(Put.builder()
                                        .tableName(TABLE_NAME)
                                        .item(userSchema.itemToMap(user, true))
                                        .conditionExpression("attribute_not_exists(id)")
                                        .build())
                                .build()
                )
                .build();

        return performanceTracker.trackQuery("createUserWithPhoneNumberClaim", TABLE_NAME, () -> {
            try {
                dynamoDbClient.transactWriteItems(request);
                return true;
            } catch (TransactionCanceledException e) {
                if (!isConditionFailure(e)) {
                    throw e;
                }
                logger.info("Phone number {} already claimed, user {} not created", user.getPhoneNumber(), user.getId());
                return false;
            }
        });
    }

    private static boolean isConditionFailure(TransactionCanceledException e) {
        return e.hasCancellationReasons() && e.cancellationReasons().stream()
                .anyMatch(reason -> CONDITIONAL_CHECK_FAILED.equals(reason.code()));
    }

    private static GetItemEnhancedRequest consistentGet(String partitionValue) {
        return GetItemEnhancedRequest.builder()
                .key(Key.builder().partitionValue(partitionValue).build())
                .consistentRead(true)
                .build();
    }
}
