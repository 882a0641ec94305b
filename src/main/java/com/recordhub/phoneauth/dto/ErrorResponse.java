package com.recordhub.phoneauth.dto;

/**
 * Error body shared by every failing endpoint.
 */
public class ErrorResponse {
    private final String error;
    private final String message;
    private final long timestamp;

    public ErrorResponse(String error, String message) {
        this.error = error;
        this.message = message;
        this.timestamp = System.currentTimeMillis();
    }

    public String getError() { return error; }
    public String getMessage() { return message; }
    public long getTimestamp() { return timestamp; }
}
