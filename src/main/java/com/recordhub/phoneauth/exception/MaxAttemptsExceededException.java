package com.recordhub.phoneauth.exception;

/**
 * Thrown when the attempt budget of a challenge is spent. A new code must be requested.
 */
public class MaxAttemptsExceededException extends RuntimeException {

    public MaxAttemptsExceededException() {
        super("Too many failed attempts. Please request a new code.");
    }
}
