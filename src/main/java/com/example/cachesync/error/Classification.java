package com.example.cachesync.error;

/**
 * Decision on a failure: whether the broker should redeliver the event, and why.
 */
public record Classification(boolean retryable, String reason) {

    public static Classification terminal(String reason) {
        return new Classification(false, reason);
    }

    public static Classification retryable(String reason) {
        return new Classification(true, reason);
    }
}
