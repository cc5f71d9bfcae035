package com.example.cachesync.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Audit row for an event that failed terminally and was acknowledged without retry.
 * Rows are only ever inserted.
 */
@Entity
@Table(name = "failed_events")
public class FailedEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "collection_name")
    private String collectionName;

    @Column(name = "subject_path")
    private String subjectPath;

    @Column(name = "error_kind", nullable = false)
    private String errorKind;

    @Column(nullable = false)
    private String reason;

    @Lob
    @Column
    private String message;

    @Column(nullable = false)
    private boolean terminal = true;

    @Column(name = "delivery_attempt")
    private int deliveryAttempt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected FailedEvent() {
    }

    public FailedEvent(String eventId, String collectionName, String subjectPath, String errorKind,
                       String reason, String message, int deliveryAttempt, Instant createdAt) {
        this.eventId = eventId;
        this.collectionName = collectionName;
        this.subjectPath = subjectPath;
        this.errorKind = errorKind;
        this.reason = reason;
        this.message = message;
        this.deliveryAttempt = deliveryAttempt;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getEventId() {
        return eventId;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public String getSubjectPath() {
        return subjectPath;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public int getDeliveryAttempt() {
        return deliveryAttempt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
