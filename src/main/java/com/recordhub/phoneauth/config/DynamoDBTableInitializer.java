package com.recordhub.phoneauth.config;

import com.recordhub.phoneauth.model.Challenge;
import com.recordhub.phoneauth.model.PhoneNumberClaim;
import com.recordhub.phoneauth.model.RateWindow;
import com.recordhub.phoneauth.model.User;
import com.recordhub.phoneauth.repository.UserRepository;
import com.recordhub.phoneauth.repository.impl.DynamoChallengeRepository;
import com.recordhub.phoneauth.repository.impl.DynamoRateWindowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {
    
    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;
    private final OtpProperties otpProperties;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                    DynamoDbClient dynamoDbClient,
                                    OtpProperties otpProperties) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
        this.otpProperties = otpProperties;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(UserRepository.TABLE_NAME, User.class);
        createTableIfNotExists(UserRepository.CLAIM_TABLE_NAME, PhoneNumberClaim.class);

        if (otpProperties.getStorage().getType() == OtpProperties.StorageType.DYNAMODB) {
            // Expired challenges and stale windows are reaped lazily by the table TTL
            if (createTableIfNotExists(DynamoChallengeRepository.TABLE_NAME, Challenge.class)) {
                configureTTL(DynamoChallengeRepository.TABLE_NAME, "ttl");
            }
            if (createTableIfNotExists(DynamoRateWindowRepository.TABLE_NAME, RateWindow.class)) {
                configureTTL(DynamoRateWindowRepository.TABLE_NAME, "ttl");
            }
        }
    }
    
    /**
     * @return true if the table was created by this call
     */
    private <T> boolean createTableIfNotExists(String tableName, Class<T> entityClass) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
            return false;
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            createTable(table);
            logger.info("Table {} created successfully", tableName);
            return true;
        } catch (Exception e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }
    
    private <T> void createTable(DynamoDbTable<T> table) {
        table.createTable(CreateTableEnhancedRequest.builder()
            .provisionedThroughput(ProvisionedThroughput.builder()
                .readCapacityUnits(5L)
                .writeCapacityUnits(5L)
                .build())
            .build());
    }
    
    private void configureTTL(String tableName, String ttlAttributeName) {
        try {
            logger.info("Configuring TTL for table {} on attribute {}", tableName, ttlAttributeName);
            try (DynamoDbWaiter waiter = dynamoDbClient.waiter()) {
                waiter.waitUntilTableExists(r -> r.tableName(tableName));
            }
            dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                .tableName(tableName)
                .timeToLiveSpecification(TimeToLiveSpecification.builder()
                    .attributeName(ttlAttributeName)
                    .enabled(true)
                    .build())
                .build());
        } catch (SdkException e) {
            // Reaping is best effort; expiry is always checked on read
            logger.warn("Could not configure TTL for table {} on attribute {}: {}", 
                tableName, ttlAttributeName, e.getMessage());
        }
    }
}
