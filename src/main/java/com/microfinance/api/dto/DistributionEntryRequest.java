package com.microfinance.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.microfinance.domain.model.Currency;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single disbursement tranche. Also the body of a distribution update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionEntryRequest {

    @Positive
    private BigDecimal amount;

    private Currency currency;

    @JsonAlias("member")
    private UUID memberId;

    @JsonAlias("group")
    private UUID groupId;

    @JsonAlias("date")
    private LocalDate distributionDate;

    private String notes;
}
