package com.microfinance.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A metric event before it is stored. This is the outbox payload element and
 * the message published on the metric events topic.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricEventPayload {

    private MetricName metric;
    private BigDecimal value;
    private LocalDate eventDate;

    private String branchName;
    private String branchCode;
    private String loanOfficerName;
    private Currency currency;

    private UUID loanId;
    private UUID groupId;
    private UUID clientId;
    private UUID distributionId;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isZero() {
        return value == null || value.signum() == 0;
    }
}
