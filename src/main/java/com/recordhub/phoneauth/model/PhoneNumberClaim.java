package com.recordhub.phoneauth.model;

import com.recordhub.phoneauth.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;

/**
 * Maps a phone number to the one user that owns it. Written in the same transaction as the
 * user row, under {@code attribute_not_exists}, so a phone number can never be claimed twice.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class PhoneNumberClaim {

    private String phoneNumber;
    private String userId;
    private Instant claimedAt;

    @DynamoDbPartitionKey
    public String getPhoneNumber() {
        return phoneNumber;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getClaimedAt() {
        return claimedAt;
    }
}
