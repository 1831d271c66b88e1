package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;

public enum PaymentPlan {
    WEEKLY("weekly"),
    BI_WEEKLY("bi-weekly"),
    MONTHLY("monthly");

    private final String wireName;

    PaymentPlan(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Next due date after {@code date} for this plan.
     */
    public LocalDate step(LocalDate date) {
        switch (this) {
            case BI_WEEKLY:
                return date.plusDays(14);
            case MONTHLY:
                return date.plusMonths(1);
            default:
                return date.plusDays(7);
        }
    }

    @JsonCreator
    public static PaymentPlan fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (PaymentPlan plan : values()) {
            if (plan.wireName.equalsIgnoreCase(value.trim()) || plan.name().equalsIgnoreCase(value.trim())) {
                return plan;
            }
        }
        throw new IllegalArgumentException("Unknown payment plan: " + value);
    }
}
