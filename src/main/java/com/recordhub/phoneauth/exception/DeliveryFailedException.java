package com.recordhub.phoneauth.exception;

/**
 * Thrown when the SMS provider could not dispatch a code. The challenge was already
 * persisted and stays valid; the caller may resend once the rate limit allows.
 */
public class DeliveryFailedException extends RuntimeException {

    public DeliveryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
