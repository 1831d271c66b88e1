package com.microfinance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Repayment schedule derived from a loan's terms. {@code dueDates} is empty when
 * the schedule could only be sized by formula.
 */
@Value
@Builder
public class RepaymentSchedule {
    PaymentPlan plan;
    int periodCount;
    BigDecimal totalWithInterest;
    BigDecimal perPeriodAmount;
    BigDecimal finalPeriodAmount;
    List<LocalDate> dueDates;

    /**
     * Scheduled amount for the zero-based period index. The final period absorbs rounding.
     */
    public BigDecimal amountForPeriod(int index) {
        if (periodCount <= 0 || index < 0 || index >= periodCount) {
            return BigDecimal.ZERO.setScale(2);
        }
        return index == periodCount - 1 ? finalPeriodAmount : perPeriodAmount;
    }

    /**
     * Sum of scheduled amounts for periods {@code 0..index} inclusive.
     */
    public BigDecimal expectedThrough(int index) {
        if (periodCount <= 0 || index < 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        if (index >= periodCount - 1) {
            return totalWithInterest;
        }
        return perPeriodAmount.multiply(BigDecimal.valueOf(index + 1L));
    }
}
