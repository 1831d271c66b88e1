package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-branch fee configuration. A row without a branch code is the global default;
 * at most one such row exists, enforced by the upsert path.
 */
@Entity
@Table(name = "loan_configs", indexes = {
    @Index(name = "idx_loan_config_branch", columnList = "branchCode", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanConfigEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(unique = true, length = 50)
    private String branchCode;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "processingFeePercent", column = @Column(name = "express_processing_fee_percent")),
        @AttributeOverride(name = "collateralCashPercent", column = @Column(name = "express_collateral_cash_percent")),
        @AttributeOverride(name = "formFeeAmountLrd", column = @Column(name = "express_form_fee_lrd")),
        @AttributeOverride(name = "formFeeAmountLrdNew", column = @Column(name = "express_form_fee_lrd_new")),
        @AttributeOverride(name = "formFeeAmountLrdReturning", column = @Column(name = "express_form_fee_lrd_returning")),
        @AttributeOverride(name = "inspectionFeeDefault", column = @Column(name = "express_inspection_fee_default"))
    })
    private LoanTypeConfig express;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "processingFeePercent", column = @Column(name = "individual_processing_fee_percent")),
        @AttributeOverride(name = "collateralCashPercent", column = @Column(name = "individual_collateral_cash_percent")),
        @AttributeOverride(name = "formFeeAmountLrd", column = @Column(name = "individual_form_fee_lrd")),
        @AttributeOverride(name = "formFeeAmountLrdNew", column = @Column(name = "individual_form_fee_lrd_new")),
        @AttributeOverride(name = "formFeeAmountLrdReturning", column = @Column(name = "individual_form_fee_lrd_returning")),
        @AttributeOverride(name = "inspectionFeeDefault", column = @Column(name = "individual_inspection_fee_default"))
    })
    private LoanTypeConfig individual;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "processingFeePercent", column = @Column(name = "group_processing_fee_percent")),
        @AttributeOverride(name = "collateralCashPercent", column = @Column(name = "group_collateral_cash_percent")),
        @AttributeOverride(name = "formFeeAmountLrd", column = @Column(name = "group_form_fee_lrd")),
        @AttributeOverride(name = "formFeeAmountLrdNew", column = @Column(name = "group_form_fee_lrd_new")),
        @AttributeOverride(name = "formFeeAmountLrdReturning", column = @Column(name = "group_form_fee_lrd_returning")),
        @AttributeOverride(name = "inspectionFeeDefault", column = @Column(name = "group_inspection_fee_default"))
    })
    private LoanTypeConfig group;

    @Column(length = 255)
    private String updatedBy;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

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
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
