package com.microfinance.domain.model;

/**
 * Currencies the institution books loans in. LRD is the local currency.
 */
public enum Currency {
    USD,
    LRD;

    public boolean isLocal() {
        return this == LRD;
    }
}
