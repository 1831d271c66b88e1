package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;

/**
 * Unit of a loan duration, with the canonical conversion table used for
 * every schedule computation.
 *
 * <pre>
 * unit    weeks-equivalent   months-equivalent
 * days    ceil(n/7)          ceil(n/30)
 * weeks   n                  ceil(n/4)
 * months  n*4                n
 * years   n*52               n*12
 * </pre>
 */
public enum DurationUnit {
    DAYS("days"),
    WEEKS("weeks"),
    MONTHS("months"),
    YEARS("years");

    private final String wireName;

    DurationUnit(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int toWeeks(int number) {
        int n = Math.max(number, 0);
        switch (this) {
            case DAYS:
                return ceilDiv(n, 7);
            case MONTHS:
                return n * 4;
            case YEARS:
                return n * 52;
            default:
                return n;
        }
    }

    public int toMonths(int number) {
        int n = Math.max(number, 0);
        switch (this) {
            case DAYS:
                return ceilDiv(n, 30);
            case WEEKS:
                return ceilDiv(n, 4);
            case YEARS:
                return n * 12;
            default:
                return n;
        }
    }

    public LocalDate addTo(LocalDate date, int number) {
        if (number <= 0) {
            return date;
        }
        switch (this) {
            case DAYS:
                return date.plusDays(number);
            case MONTHS:
                return date.plusMonths(number);
            case YEARS:
                return date.plusYears(number);
            default:
                return date.plusWeeks(number);
        }
    }

    private static int ceilDiv(int n, int d) {
        return (n + d - 1) / d;
    }

    @JsonCreator
    public static DurationUnit fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (DurationUnit unit : values()) {
            if (unit.wireName.equalsIgnoreCase(value.trim())) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown duration unit: " + value);
    }
}
