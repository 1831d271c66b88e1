package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One repayment observation against a loan. Entries are append-only.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionEntry {

    @Column(length = 200)
    private String memberName;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal scheduledAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal collectedAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal advancePayment;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal fieldBalance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private Currency currency;

    @Column(nullable = false)
    private LocalDate collectionDate;

    /**
     * Shortfall against the scheduled amount, never negative.
     */
    public BigDecimal overdueAmount() {
        BigDecimal scheduled = scheduledAmount == null ? BigDecimal.ZERO : scheduledAmount;
        BigDecimal collected = collectedAmount == null ? BigDecimal.ZERO : collectedAmount;
        return scheduled.subtract(collected).max(BigDecimal.ZERO);
    }
}
