package com.example.cachesync.model;

import com.example.cachesync.error.Classification;

/**
 * What happened to one delivered event. Only {@link Status#RETRYABLE} outcomes are handed back
 * to the broker as failures; everything else is acknowledged.
 */
public record ProcessingOutcome(Status status, Classification classification, Throwable failure) {

    public enum Status {
        COMPLETED,
        SKIPPED_DELETED,
        TERMINAL,
        RETRYABLE
    }

    public static ProcessingOutcome completed() {
        return new ProcessingOutcome(Status.COMPLETED, null, null);
    }

    public static ProcessingOutcome skippedDeleted() {
        return new ProcessingOutcome(Status.SKIPPED_DELETED, null, null);
    }

    public static ProcessingOutcome failed(Classification classification, Throwable failure) {
        Status status = classification.retryable() ? Status.RETRYABLE : Status.TERMINAL;
        return new ProcessingOutcome(status, classification, failure);
    }

    public boolean shouldRedeliver() {
        return status == Status.RETRYABLE;
    }
}
