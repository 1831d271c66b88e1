package com.microfinance.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.MetricName;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Manual metric entry, single or batched via {@code entries}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricEventRequest {

    private MetricName metric;
    private BigDecimal value;

    @JsonAlias("eventDate")
    private LocalDate date;

    private String branchName;
    private String branchCode;
    private String loanOfficerName;
    private Currency currency;
    private Map<String, Object> extra;

    private List<@Valid MetricEventRequest> entries;
}
