package com.example.cachesync.model;

/**
 * One delivered notification of a document mutation.
 *
 * @param eventId         broker-assigned identifier, stable across redeliveries
 * @param collectionName  collection the changed document belongs to
 * @param subjectPath     document path such as {@code feedEvents/abc123}
 * @param rawPayload      undecoded event data
 * @param deliveryAttempt 1 for the first delivery, incremented by the broker on redelivery
 */
public record ChangeEvent(
        String eventId,
        String collectionName,
        String subjectPath,
        RawPayload rawPayload,
        int deliveryAttempt
) {
}
