package com.microfinance.domain.service;

import com.microfinance.api.dto.LoanRequest;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.function.Consumer;

/**
 * Copies request fields onto the loan aggregate. Derived fee amounts are never copied.
 */
@Component
public class LoanMapper {

    public LoanEntity toEntity(LoanRequest request) {
        LoanEntity loan = LoanEntity.builder()
                .currency(Currency.LRD)
                .loanDurationUnit(DurationUnit.WEEKS)
                .clientIds(new ArrayList<>())
                .guarantors(new ArrayList<>())
                .collections(new ArrayList<>())
                .build();
        applyUpdate(loan, request);
        return loan;
    }

    /**
     * Apply every non-null request field to the loan.
     */
    public void applyUpdate(LoanEntity loan, LoanRequest request) {
        set(request.getBranchName(), loan::setBranchName);
        set(request.getBranchCode(), loan::setBranchCode);
        set(request.getLoanOfficerName(), loan::setLoanOfficerName);
        set(request.getCategory(), loan::setCategory);
        set(request.getGroupId(), loan::setGroupId);
        if (request.getClientIds() != null) {
            loan.setClientIds(new ArrayList<>(request.getClientIds()));
        }
        set(request.getClientId(), loan::setClientId);

        set(request.getLoanAmount(), loan::setLoanAmount);
        set(request.getInterestRate(), loan::setInterestRate);
        set(request.getCurrency(), loan::setCurrency);
        set(request.getPaymentPlan(), loan::setPaymentPlan);
        set(request.getLoanDurationNumber(), loan::setLoanDurationNumber);
        set(request.getLoanDurationUnit(), loan::setLoanDurationUnit);
        set(request.getDisbursementDate(), loan::setDisbursementDate);
        set(request.getCollectionStartDate(), loan::setCollectionStartDate);
        set(request.getEndingDate(), loan::setEndingDate);

        set(request.getProcessingFeePercent(), loan::setProcessingFeePercent);
        set(request.getCollateralCashPercent(), loan::setCollateralCashPercent);
        set(request.getFormFeeAmount(), loan::setFormFeeAmount);
        set(request.getInspectionFeeAmount(), loan::setInspectionFeeAmount);
        set(request.getTotalAmountToBePaid(), loan::setTotalAmountToBePaid);
        set(request.getCashAmountCredited(), loan::setCashAmountCredited);
        set(request.getInterestDeductedOrAdded(), loan::setInterestDeductedOrAdded);
        if (request.getReturningClient() != null) {
            loan.setReturningClient(request.getReturningClient());
        }

        set(request.getFormNumber(), loan::setFormNumber);
        set(request.getApplicationDate(), loan::setApplicationDate);
        set(request.getMeetingDay(), loan::setMeetingDay);
        set(request.getMeetingTime(), loan::setMeetingTime);
        set(request.getMemberCode(), loan::setMemberCode);
        set(request.getMemberAddress(), loan::setMemberAddress);
        set(request.getLoanAmountInWords(), loan::setLoanAmountInWords);
        set(request.getPurposeOfLoan(), loan::setPurposeOfLoan);
        set(request.getBusinessType(), loan::setBusinessType);
        if (request.getGuarantors() != null) {
            loan.setGuarantors(new ArrayList<>(request.getGuarantors()));
        }
        set(request.getCreditorInfo(), loan::setCreditorInfo);
        set(request.getCollateralDetails(), loan::setCollateralDetails);
        set(request.getCollateralItemsText(), loan::setCollateralItemsText);
        set(request.getAttestedBy(), loan::setAttestedBy);
        set(request.getApprovedBy(), loan::setApprovedBy);
    }

    private static <T> void set(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
