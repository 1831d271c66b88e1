package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.MetricName;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable signed-value financial event.
 *
 * The balance of a metric for a set of dimensions is the sum of its events.
 * Reversals are negative events; rows are never updated. The only deletions are
 * the loan purge and the loan-derived sweep at the start of a recalculation.
 */
@Entity
@Table(name = "metric_events", indexes = {
    @Index(name = "idx_metric_name_date", columnList = "metric,eventDate"),
    @Index(name = "idx_metric_loan", columnList = "loanId"),
    @Index(name = "idx_metric_branch", columnList = "branchCode"),
    @Index(name = "idx_metric_outbox", columnList = "outboxEventId")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50, updatable = false)
    private MetricName metric;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal value;

    @Column(nullable = false, updatable = false)
    private LocalDate eventDate;

    @Column(length = 100, updatable = false)
    private String branchName;

    @Column(length = 50, updatable = false)
    private String branchCode;

    @Column(length = 100, updatable = false)
    private String loanOfficerName;

    @Enumerated(EnumType.STRING)
    @Column(length = 3, updatable = false)
    private Currency currency;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID loanId;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID groupId;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID clientId;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID distributionId;

    // outbox record this event was relayed from; null for recalculated and manual events
    @Column(columnDefinition = "UUID", updatable = false)
    private UUID outboxEventId;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
