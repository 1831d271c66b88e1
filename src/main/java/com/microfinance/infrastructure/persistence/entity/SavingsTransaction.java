package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsTransaction {

    @Column(nullable = false)
    private LocalDate transactionDate;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal savingAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal withdrawalAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private Currency currency;

    // e.g. "collateral:<loanId>" for automatic collateral deposits
    @Column(length = 100)
    private String reference;

    @Column(length = 100)
    private String branchName;

    @Column(length = 50)
    private String branchCode;
}
