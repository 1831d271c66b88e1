package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Loan product category. Determines which relations a loan must carry
 * and how its fee defaults are resolved.
 */
public enum LoanCategory {
    EXPRESS("express"),
    GROUP("group"),
    INDIVIDUAL("individual");

    private final String wireName;

    LoanCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static LoanCategory fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (LoanCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value.trim()) || category.name().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown loan category: " + value);
    }
}
