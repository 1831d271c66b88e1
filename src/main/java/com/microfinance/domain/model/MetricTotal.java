package com.microfinance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Signed sum of a metric's events for one currency.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricTotal {
    private MetricName metric;
    private Currency currency;
    private BigDecimal total;
    private long eventCount;
}
