package com.microfinance.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.PaymentPlan;
import com.microfinance.infrastructure.persistence.entity.CollateralDetails;
import com.microfinance.infrastructure.persistence.entity.CreditorInfo;
import com.microfinance.infrastructure.persistence.entity.Signatory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Loan create and update body. On update only the fields present are applied.
 * Fee amounts and the net disbursed amount are always derived and cannot be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanRequest {

    private String branchName;
    private String branchCode;
    private String loanOfficerName;

    @JsonAlias("loanType")
    private LoanCategory category;

    @JsonAlias("group")
    private UUID groupId;

    @JsonAlias("clients")
    private List<UUID> clientIds;

    @JsonAlias("client")
    private UUID clientId;

    @Positive
    private BigDecimal loanAmount;

    @PositiveOrZero
    private BigDecimal interestRate;

    private Currency currency;
    private PaymentPlan paymentPlan;

    @PositiveOrZero
    private Integer loanDurationNumber;

    private DurationUnit loanDurationUnit;

    private LocalDate disbursementDate;
    private LocalDate collectionStartDate;
    private LocalDate endingDate;

    @PositiveOrZero
    @DecimalMax("100")
    private BigDecimal processingFeePercent;

    @PositiveOrZero
    @DecimalMax("100")
    private BigDecimal collateralCashPercent;

    @PositiveOrZero
    private BigDecimal formFeeAmount;

    @PositiveOrZero
    private BigDecimal inspectionFeeAmount;

    @PositiveOrZero
    private BigDecimal totalAmountToBePaid;

    @PositiveOrZero
    private BigDecimal cashAmountCredited;

    private BigDecimal interestDeductedOrAdded;

    @JsonAlias("isReturningClient")
    private Boolean returningClient;

    // Loan document metadata
    private String formNumber;
    private String applicationDate;
    private String meetingDay;
    private String meetingTime;
    private String memberCode;
    private String memberAddress;
    private String loanAmountInWords;
    private String purposeOfLoan;
    private String businessType;
    private List<Signatory> guarantors;
    private CreditorInfo creditorInfo;
    private CollateralDetails collateralDetails;
    private String collateralItemsText;
    private String attestedBy;
    private String approvedBy;
}
