package com.example.cachesync.error;

/**
 * Thrown out of the listener so the container redelivers the record.
 */
public class RetryableProcessingException extends RuntimeException {

    private final String reason;

    public RetryableProcessingException(String eventId, String reason, Throwable cause) {
        super("Event " + eventId + " failed with retryable error (" + reason + ")", cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
