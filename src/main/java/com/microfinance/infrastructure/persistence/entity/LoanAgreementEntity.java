package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Loan agreement document generated from a loan snapshot on activation.
 * Exactly one per loan, enforced by the unique loan id.
 */
@Entity
@Table(name = "loan_agreements", indexes = {
    @Index(name = "idx_agreement_loan", columnList = "loanId", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanAgreementEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, unique = true, columnDefinition = "UUID")
    private UUID loanId;

    @Column(length = 100)
    private String branchName;

    @Column(length = 50)
    private String branchCode;

    @Column(length = 100)
    private String loanOfficerName;

    @Enumerated(EnumType.STRING)
    @Column(length = 3)
    private Currency currency;

    @Column(length = 50)
    private String formNumber;

    private LocalDate dateOfCredit;

    @Column(precision = 19, scale = 2)
    private BigDecimal cashAmountCredited;

    @Column(length = 500)
    private String amountInWords;

    @Column(length = 500)
    private String purposeOfLoan;

    @Column(precision = 19, scale = 2)
    private BigDecimal interestDeductedOrAdded;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalAmountToBePaid;

    @Column(length = 200)
    private String nameOfCreditor;

    @Column(length = 10)
    private String creditorSex;

    @Column(length = 100)
    private String creditorContacts;

    @Column(length = 200)
    private String typeOfBusinessOrJob;

    @Column(length = 500)
    private String presentAddress;

    @Column(length = 500)
    private String businessAddress;

    @Column(columnDefinition = "TEXT")
    private String collateralItemsText;

    @Column(length = 500)
    private String collateralItemsLocation;

    @Column(length = 200)
    private String bondsperson1Name;

    @Column(length = 100)
    private String bondsperson1Contacts;

    @Column(length = 200)
    private String bondsperson2Name;

    @Column(length = 100)
    private String bondsperson2Contacts;

    @Column(length = 200)
    private String attestedBy;

    @Column(length = 200)
    private String approvedBy;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
