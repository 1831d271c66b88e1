package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Loan lifecycle states.
 *
 * pending -> active -> paid | defaulted. Paid and defaulted are terminal.
 */
public enum LoanStatus {
    PENDING("pending"),
    ACTIVE("active"),
    PAID("paid"),
    DEFAULTED("defaulted");

    private final String wireName;

    LoanStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Set<LoanStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ACTIVE);
            case ACTIVE:
                return EnumSet.of(PAID, DEFAULTED);
            default:
                return EnumSet.noneOf(LoanStatus.class);
        }
    }

    public boolean canTransitionTo(LoanStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * True for every state a loan can only reach by having been activated.
     */
    public boolean hasBeenActivated() {
        return this != PENDING;
    }

    @JsonCreator
    public static LoanStatus fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (LoanStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value);
    }
}
