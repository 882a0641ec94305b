package com.recordhub.phoneauth.service;

/**
 * Outbound SMS channel for verification codes.
 */
public interface SmsGateway {

    /**
     * Dispatches a rendered message.
     *
     * @param phoneNumber E.164 destination
     * @param message the full text, code included
     * @return the provider's reference for the dispatched message
     * @throws com.recordhub.phoneauth.exception.DeliveryFailedException if the provider rejected or
     *         could not be reached
     */
    String send(String phoneNumber, String message);
}
