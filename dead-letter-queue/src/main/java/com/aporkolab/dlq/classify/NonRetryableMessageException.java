package com.aporkolab.dlq.classify;

/**
 * Thrown by handlers to mark a permanent failure.
 * Always classified as non-retryable, whatever the registry holds.
 */
public class NonRetryableMessageException extends RuntimeException {

    public NonRetryableMessageException(String message) {
        super(message);
    }

    public NonRetryableMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
