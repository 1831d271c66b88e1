package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A disbursement tranche paid out against an active loan.
 */
@Entity
@Table(name = "distributions", indexes = {
    @Index(name = "idx_distribution_loan", columnList = "loanId"),
    @Index(name = "idx_distribution_branch", columnList = "branchCode"),
    @Index(name = "idx_distribution_date", columnList = "distributionDate")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID loanId;

    @Column(columnDefinition = "UUID")
    private UUID groupId;

    @Column(columnDefinition = "UUID")
    private UUID memberId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private Currency currency;

    @Column(nullable = false)
    private LocalDate distributionDate;

    @Column(length = 1000)
    private String notes;

    @Column(length = 100)
    private String branchName;

    @Column(length = 50)
    private String branchCode;

    @Column(length = 255)
    private String createdByEmail;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
