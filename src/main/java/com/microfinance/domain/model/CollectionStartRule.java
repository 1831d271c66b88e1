package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Named rules for deriving a collection start date from an anchor date.
 */
public enum CollectionStartRule {
    ONE_WEEK_AFTER("one_week_after"),
    NEXT_WEEK("next_week");

    private final String wireName;

    CollectionStartRule(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public LocalDate apply(LocalDate anchor) {
        if (this == NEXT_WEEK) {
            // strictly after: a Monday anchor moves to the following Monday
            return anchor.with(TemporalAdjusters.next(DayOfWeek.MONDAY));
        }
        return anchor.plusDays(7);
    }

    @JsonCreator
    public static CollectionStartRule fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (CollectionStartRule rule : values()) {
            if (rule.wireName.equalsIgnoreCase(value.trim())) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown collection start rule: " + value);
    }
}
