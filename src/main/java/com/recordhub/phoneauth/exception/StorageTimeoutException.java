package com.recordhub.phoneauth.exception;

/**
 * Thrown when a storage call exceeds its bounded timeout.
 */
public class StorageTimeoutException extends RepositoryException {

    public StorageTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
