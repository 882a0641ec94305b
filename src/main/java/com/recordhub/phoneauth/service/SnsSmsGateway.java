package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.exception.DeliveryFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.sns.model.SnsException;

import java.util.HashMap;
import java.util.Map;

/**
 * Sends verification SMS through AWS SNS direct publish. The SNS message id is the delivery reference.
 */
@Service
public class SnsSmsGateway implements SmsGateway {

    private static final Logger logger = LoggerFactory.getLogger(SnsSmsGateway.class);

    private final SnsClient snsClient;

    public SnsSmsGateway(SnsClient snsClient) {
        this.snsClient = snsClient;
    }

    @Override
    public String send(String phoneNumber, String message) {
        try {
            Map<String, MessageAttributeValue> messageAttributes = new HashMap<>();
            messageAttributes.put("AWS.SNS.SMS.SMSType",
                MessageAttributeValue.builder()
                    .stringValue("Transactional")
                    .dataType("String")
                    .build());

            PublishRequest request = PublishRequest.builder()
                .phoneNumber(phoneNumber)
                .message(message)
                .messageAttributes(messageAttributes)
                .build();

            PublishResponse response = snsClient.publish(request);

            logger.info("SMS sent successfully to {} with messageId: {}", phoneNumber, response.messageId());
            return response.messageId();

        } catch (SnsException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Failed to send SMS to {}: {}", phoneNumber, detail, e);
            throw new DeliveryFailedException("Failed to send verification SMS", e);
        } catch (SdkException e) {
            logger.error("Unexpected error sending SMS to {}: {}", phoneNumber, e.getMessage(), e);
            throw new DeliveryFailedException("Failed to send verification SMS", e);
        }
    }
}
