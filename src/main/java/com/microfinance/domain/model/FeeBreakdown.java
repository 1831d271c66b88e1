package com.microfinance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived fee amounts for one loan, all rounded to two decimals.
 */
@Value
@Builder
public class FeeBreakdown {
    BigDecimal processingFeePercent;
    BigDecimal processingFeeAmount;
    BigDecimal collateralCashPercent;
    BigDecimal collateralCashAmount;
    BigDecimal formFeeAmount;
    BigDecimal inspectionFeeAmount;
    BigDecimal netDisbursedAmount;
}
