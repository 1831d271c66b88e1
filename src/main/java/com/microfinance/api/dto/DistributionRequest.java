package com.microfinance.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.microfinance.domain.model.CollectionStartRule;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Distribution create body: one tranche inline, or several in {@code entries}.
 * The optional schedule fields adjust the parent loan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionRequest {

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

    private List<@Valid DistributionEntryRequest> entries;

    // Loan schedule adjustments
    private LocalDate collectionStartDate;
    private CollectionStartRule collectionStartRule;
    private LocalDate collectionStartAnchor;

    @PositiveOrZero
    private Integer loanDurationNumber;
    private DurationUnit loanDurationUnit;

    /**
     * The tranches carried by this request, batch entries first.
     */
    public List<DistributionEntryRequest> tranches() {
        if (entries != null && !entries.isEmpty()) {
            return entries;
        }
        List<DistributionEntryRequest> single = new ArrayList<>();
        single.add(DistributionEntryRequest.builder()
                .amount(amount)
                .currency(currency)
                .memberId(memberId)
                .groupId(groupId)
                .distributionDate(distributionDate)
                .notes(notes)
                .build());
        return single;
    }
}
