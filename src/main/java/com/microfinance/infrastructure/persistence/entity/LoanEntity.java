package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.PaymentPlan;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The loan aggregate.
 *
 * Fee amounts and the net disbursed amount are derived on every save and are
 * never taken from input. Collections are embedded and append-only.
 * Optimistic locking protects the collection ledger against lost updates.
 */
@Entity
@Table(name = "loans", indexes = {
    @Index(name = "idx_loan_branch", columnList = "branchCode"),
    @Index(name = "idx_loan_group", columnList = "groupId"),
    @Index(name = "idx_loan_status", columnList = "status"),
    @Index(name = "idx_loan_created_by", columnList = "createdByEmail"),
    @Index(name = "idx_loan_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 100)
    private String branchName;

    @Column(nullable = false, length = 50)
    private String branchCode;

    @Column(length = 255)
    private String createdByEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LoanCategory category;

    // Relations
    @Column(columnDefinition = "UUID")
    private UUID groupId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "loan_clients", joinColumns = @JoinColumn(name = "loan_id"))
    @OrderColumn(name = "position")
    @Column(name = "client_id", columnDefinition = "UUID")
    @Builder.Default
    private List<UUID> clientIds = new ArrayList<>();

    @Column(columnDefinition = "UUID")
    private UUID clientId;

    // Financial terms
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal loanAmount;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    @Builder.Default
    private Currency currency = Currency.LRD;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private LoanStatus status = LoanStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private PaymentPlan paymentPlan;

    private Integer loanDurationNumber;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    @Builder.Default
    private DurationUnit loanDurationUnit = DurationUnit.WEEKS;

    private LocalDate disbursementDate;

    private LocalDate collectionStartDate;

    private LocalDate endingDate;

    @Column(precision = 19, scale = 2)
    private BigDecimal weeklyInstallment;

    // Derived fee fields
    @Column(precision = 9, scale = 4)
    private BigDecimal processingFeePercent;

    @Column(precision = 19, scale = 2)
    private BigDecimal processingFeeAmount;

    @Column(precision = 9, scale = 4)
    private BigDecimal collateralCashPercent;

    @Column(precision = 19, scale = 2)
    private BigDecimal collateralCashAmount;

    @Column(precision = 19, scale = 2)
    private BigDecimal formFeeAmount;

    @Column(precision = 19, scale = 2)
    private BigDecimal inspectionFeeAmount;

    @Column(precision = 19, scale = 2)
    private BigDecimal netDisbursedAmount;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalAmountToBePaid;

    @Column(precision = 19, scale = 2)
    private BigDecimal cashAmountCredited;

    @Column(precision = 19, scale = 2)
    private BigDecimal interestDeductedOrAdded;

    private boolean returningClient;

    // Collections
    @Column(nullable = false, length = 100)
    private String loanOfficerName;

    @Column(nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalRealization = BigDecimal.ZERO;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "loan_collections", joinColumns = @JoinColumn(name = "loan_id"))
    @OrderColumn(name = "entry_index")
    @Builder.Default
    private List<CollectionEntry> collections = new ArrayList<>();

    // Loan document metadata
    @Column(length = 50)
    private String formNumber;

    @Column(length = 50)
    private String applicationDate;

    @Column(length = 20)
    private String meetingDay;

    @Column(length = 20)
    private String meetingTime;

    @Column(length = 50)
    private String memberCode;

    @Column(length = 500)
    private String memberAddress;

    @Column(length = 500)
    private String loanAmountInWords;

    @Column(length = 500)
    private String purposeOfLoan;

    @Column(length = 200)
    private String businessType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "loan_guarantors", joinColumns = @JoinColumn(name = "loan_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<Signatory> guarantors = new ArrayList<>();

    @Embedded
    private CreditorInfo creditorInfo;

    @Embedded
    private CollateralDetails collateralDetails;

    @Column(columnDefinition = "TEXT")
    private String collateralItemsText;

    @Column(length = 200)
    private String attestedBy;

    @Column(length = 200)
    private String approvedBy;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
        if (status == null) {
            status = LoanStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean hasSingleClient() {
        return clientId != null;
    }

    /**
     * Individual loans linked to a group count toward the group's loan total.
     */
    public boolean countsTowardGroupTotal() {
        return category == LoanCategory.INDIVIDUAL && groupId != null;
    }

    /**
     * Append collection entries and advance the realized total by their collected amounts.
     */
    public void appendCollections(List<CollectionEntry> entries) {
        BigDecimal added = BigDecimal.ZERO;
        for (CollectionEntry entry : entries) {
            collections.add(entry);
            added = added.add(entry.getCollectedAmount());
        }
        BigDecimal current = totalRealization == null ? BigDecimal.ZERO : totalRealization;
        totalRealization = current.add(added);
    }
}
