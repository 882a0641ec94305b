package com.recordhub.phoneauth.model;

import com.recordhub.phoneauth.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class User {
    private UUID id;
    private String phoneNumber;
    private String displayName;
    private Boolean active;
    private Instant creationDate;
    private Instant lastLoginAt;
    
    public User(String phoneNumber, Instant now) {
        this.id = UUID.randomUUID();
        this.phoneNumber = phoneNumber;
        this.displayName = "";
        this.active = true;
        this.creationDate = now;
        this.lastLoginAt = null;
    }
    
    @DynamoDbPartitionKey
    public UUID getId() {
        return id;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreationDate() {
        return creationDate;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLastLoginAt() {
        return lastLoginAt;
    }
}
