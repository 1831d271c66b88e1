package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Borrower group. {@code groupLoanTotal} caches the principal sum of member
 * individual loans and can always be recomputed from the loans table.
 */
@Entity
@Table(name = "borrower_groups", indexes = {
    @Index(name = "idx_group_code", columnList = "groupCode", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 200)
    private String groupName;

    @Column(nullable = false, unique = true, length = 50)
    private String groupCode;

    @Column(nullable = false, length = 100)
    private String branchName;

    @Column(nullable = false, length = 50)
    private String branchCode;

    @Column(length = 255)
    private String createdByEmail;

    @Column(nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal groupLoanTotal = BigDecimal.ZERO;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

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
