package com.recordhub.phoneauth.util;

import com.recordhub.phoneauth.exception.RepositoryException;
import com.recordhub.phoneauth.exception.StorageTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.function.Supplier;

/**
 * Utility for tracking DynamoDB query performance.
 * Logs slow queries, records metrics for monitoring and translates SDK failures into
 * {@link RepositoryException}s. Conditional check failures pass through untouched because
 * callers treat them as a normal outcome.
 */
@Component
public class QueryPerformanceTracker {
    
    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;
    
    private final MeterRegistry meterRegistry;
    
    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Track a query operation with performance monitoring.
     * 
     * @param operation The operation name for logging/metrics
     * @param table The table name being queried
     * @param queryOperation The query operation to execute
     * @return The result of the query operation
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        
        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;
            
            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB query detected: operation={}, table={}, duration={}ms", 
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB query completed: operation={}, table={}, duration={}ms", 
                    operation, table, duration);
            }
            
            return result;

        } catch (ConditionalCheckFailedException e) {
            logger.debug("DynamoDB condition not met: operation={}, table={}", operation, table);
            throw e;

        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            logger.error("DynamoDB query timed out: operation={}, table={}, duration={}ms",
                operation, table, System.currentTimeMillis() - startTime);
            throw new StorageTimeoutException("Storage call timed out: " + operation, e);

        } catch (DynamoDbException | SdkClientException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("DynamoDB query failed: operation={}, table={}, duration={}ms, error={}", 
                operation, table, duration, e.getMessage());
            throw new RepositoryException("Storage call failed: " + operation, e);
            
        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .register(meterRegistry));
        }
    }
}
