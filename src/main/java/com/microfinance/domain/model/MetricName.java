package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of financial metrics tracked by the metric event store.
 */
public enum MetricName {
    LOAN_AMOUNT_DISTRIBUTED("loanAmountDistributed", true),
    WAITING_TO_BE_COLLECTED("waitingToBeCollected", true),
    OVERDUE("overdue", true),
    INTEREST_COLLECTED("interestCollected", true),
    TOTAL_COLLECTIONS_COLLECTED("totalCollectionsCollected", true),
    TOTAL_COLLATERAL("totalCollateral", true),
    COLLATERAL_CASH_REQUIRED("collateralCashRequired", true),
    TOTAL_FORM_FEES("totalFormFees", true),
    TOTAL_INSPECTION_FEES("totalInspectionFees", true),
    TOTAL_PROCESSING_FEES("totalProcessingFees", true),
    COLLATERAL_CASH_DEPOSITED("collateralCashDeposited", true),
    EXPENSES("expenses", false),
    SAVINGS_DEPOSITED("savingsDeposited", false);

    private final String wireName;
    private final boolean loanDerived;

    MetricName(String wireName, boolean loanDerived) {
        this.wireName = wireName;
        this.loanDerived = loanDerived;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Loan-derived metrics are rebuilt by recalculation; the others are entered manually.
     */
    public boolean isLoanDerived() {
        return loanDerived;
    }

    public static Set<MetricName> loanDerivedMetrics() {
        Set<MetricName> result = EnumSet.noneOf(MetricName.class);
        for (MetricName name : values()) {
            if (name.loanDerived) {
                result.add(name);
            }
        }
        return result;
    }

    @JsonCreator
    public static MetricName fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (MetricName name : values()) {
            if (name.wireName.equals(value.trim()) || name.name().equalsIgnoreCase(value.trim())) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + value);
    }
}
