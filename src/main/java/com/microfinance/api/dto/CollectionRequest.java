package com.microfinance.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.microfinance.domain.model.Currency;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One field collection. Omitted amounts are derived from the loan's schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionRequest {

    private String memberName;

    @PositiveOrZero
    @JsonAlias("weeklyAmount")
    private BigDecimal scheduledAmount;

    @PositiveOrZero
    @JsonAlias("fieldCollection")
    private BigDecimal collectedAmount;

    @PositiveOrZero
    private BigDecimal advancePayment;

    private BigDecimal fieldBalance;

    private Currency currency;

    private LocalDate collectionDate;
}
