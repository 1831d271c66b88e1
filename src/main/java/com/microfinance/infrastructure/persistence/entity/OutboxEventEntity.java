package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbox record carrying metric event intents.
 *
 * Written in the same transaction as the ledger mutation that produced the intents,
 * then applied to the metric event store and published by the relay.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID eventId;

    @Column(nullable = false, length = 50)
    private String eventType;

    @Column(nullable = false, length = 100)
    private String aggregateId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    @Column
    private Integer retryCount;

    @Column(length = 500)
    private String errorMessage;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED,
        // replaced by a full metrics recalculation, never applied
        SUPERSEDED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }

    public void markPublished() {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = EventStatus.FAILED;
        this.errorMessage = error == null ? null : error.substring(0, Math.min(error.length(), 500));
        this.retryCount = (retryCount == null ? 0 : retryCount) + 1;
    }
}
