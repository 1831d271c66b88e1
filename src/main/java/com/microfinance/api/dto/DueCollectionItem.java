package com.microfinance.api.dto;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.LoanCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One scheduled installment falling due inside the report window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DueCollectionItem {
    private UUID loanId;
    private LoanCategory category;
    private String branchName;
    private String branchCode;
    private String loanOfficerName;
    private UUID groupId;
    private UUID clientId;
    private Currency currency;
    private LocalDate dueDate;
    private int periodIndex;
    private int periodCount;
    private BigDecimal scheduledAmount;
    private BigDecimal expectedToDate;
    private BigDecimal totalRealization;
    private BigDecimal arrears;
}
