package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Fee parameters for a single loan category. Every field is optional;
 * callers fall back to built-in constants for anything missing.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanTypeConfig {

    @Column(precision = 9, scale = 4)
    private BigDecimal processingFeePercent;

    @Column(precision = 9, scale = 4)
    private BigDecimal collateralCashPercent;

    // flat LRD form fee for group loans and individuals linked to a group
    @Column(precision = 19, scale = 2)
    private BigDecimal formFeeAmountLrd;

    @Column(precision = 19, scale = 2)
    private BigDecimal formFeeAmountLrdNew;

    @Column(precision = 19, scale = 2)
    private BigDecimal formFeeAmountLrdReturning;

    @Column(precision = 19, scale = 2)
    private BigDecimal inspectionFeeDefault;
}
