package com.recordhub.phoneauth.config;

import com.recordhub.phoneauth.repository.ChallengeRepository;
import com.recordhub.phoneauth.repository.RateWindowRepository;
import com.recordhub.phoneauth.repository.impl.DynamoChallengeRepository;
import com.recordhub.phoneauth.repository.impl.DynamoRateWindowRepository;
import com.recordhub.phoneauth.repository.impl.InMemoryChallengeRepository;
import com.recordhub.phoneauth.repository.impl.InMemoryRateWindowRepository;
import com.recordhub.phoneauth.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Selects the backing store for OTP challenges and rate windows.
 * <p>
 * Controlled by {@code otp.storage.type}:
 * - "dynamodb" (default): conditional updates against DynamoDB, safe across instances
 * - "memory": Caffeine caches, for a single instance or local development
 */
@Configuration
public class OtpStorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(OtpStorageConfig.class);

    @Bean
    @ConditionalOnProperty(name = "otp.storage.type", havingValue = "dynamodb", matchIfMissing = true)
    public ChallengeRepository dynamoChallengeRepository(DynamoDbClient dynamoDbClient,
                                                         DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                                         QueryPerformanceTracker performanceTracker) {
        logger.info("Configuring DynamoDB challenge store (table {})", DynamoChallengeRepository.TABLE_NAME);
        return new DynamoChallengeRepository(dynamoDbClient, dynamoDbEnhancedClient, performanceTracker);
    }

    @Bean
    @ConditionalOnProperty(name = "otp.storage.type", havingValue = "dynamodb", matchIfMissing = true)
    public RateWindowRepository dynamoRateWindowRepository(DynamoDbClient dynamoDbClient,
                                                           DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                                           QueryPerformanceTracker performanceTracker) {
        logger.info("Configuring DynamoDB rate window store (table {})", DynamoRateWindowRepository.TABLE_NAME);
        return new DynamoRateWindowRepository(dynamoDbClient, dynamoDbEnhancedClient, performanceTracker);
    }

    @Bean
    @ConditionalOnProperty(name = "otp.storage.type", havingValue = "memory")
    public ChallengeRepository inMemoryChallengeRepository(OtpProperties properties) {
        logger.warn("Configuring in-memory challenge store; challenges are lost on restart and not shared between instances");
        return new InMemoryChallengeRepository(properties.getTtl().plus(properties.getStorage().getRetention()));
    }

    @Bean
    @ConditionalOnProperty(name = "otp.storage.type", havingValue = "memory")
    public RateWindowRepository inMemoryRateWindowRepository(OtpProperties properties) {
        logger.warn("Configuring in-memory rate window store");
        return new InMemoryRateWindowRepository(properties.getRateLimit().getWindow().multipliedBy(2));
    }
}
