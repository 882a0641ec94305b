package com.recordhub.phoneauth.exception;

/**
 * Thrown for a wrong code, a missing challenge, an expired challenge or an already used one.
 * The message is identical in every case so callers cannot learn the state of a phone number.
 */
public class InvalidOrExpiredCodeException extends RuntimeException {

    public static final String MESSAGE = "The verification code is invalid or has expired.";

    public InvalidOrExpiredCodeException() {
        super(MESSAGE);
    }
}
