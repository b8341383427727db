package com.authplatform.validitysvc.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Validity change waiting to be relayed to Kafka. The aggregate id is the account id.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    static final int MAX_ERROR_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 255)
    private String aggregateId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "payload_json", nullable = false, length = 4000)
    private String payloadJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    private OutboxEvent(String aggregateType, String userId, String eventType, String payloadJson) {
        this.aggregateType = aggregateType;
        this.aggregateId = userId;
        this.eventType = eventType;
        this.payloadJson = payloadJson;
    }

    public static OutboxEvent forAccount(String aggregateType, String userId, String eventType, String payloadJson) {
        return new OutboxEvent(aggregateType, userId, eventType, payloadJson);
    }

    @PrePersist
    protected void stampCreation() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isProcessed() {
        return processedAt != null;
    }

    public void markAsProcessed() {
        this.processedAt = Instant.now();
    }

    /**
     * Counts a failed relay attempt. Errors longer than the column are cut.
     */
    public void recordFailure(String error) {
        this.retryCount++;
        if (error != null && error.length() > MAX_ERROR_LENGTH) {
            error = error.substring(0, MAX_ERROR_LENGTH);
        }
        this.lastError = error;
    }
}
