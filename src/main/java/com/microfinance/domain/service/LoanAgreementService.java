package com.microfinance.domain.service;

import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.CollateralDetails;
import com.microfinance.infrastructure.persistence.entity.CreditorInfo;
import com.microfinance.infrastructure.persistence.entity.LoanAgreementEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.Signatory;
import com.microfinance.infrastructure.persistence.repository.LoanAgreementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Generates the loan agreement document from a loan snapshot.
 *
 * One agreement per loan; the unique loan id column settles concurrent
 * creators, the loser sees a {@code DataIntegrityViolationException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanAgreementService {

    private final LoanAgreementRepository loanAgreementRepository;
    private final FeeScheduleCalculator calculator;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public LoanAgreementEntity ensureAgreement(LoanEntity loan) {
        Optional<LoanAgreementEntity> existing = loanAgreementRepository.findByLoanId(loan.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        LoanAgreementEntity agreement = loanAgreementRepository.saveAndFlush(fromLoan(loan));
        log.info("Loan agreement {} generated for loan {}", agreement.getId(), loan.getId());
        return agreement;
    }

    @Transactional(readOnly = true)
    public Optional<LoanAgreementEntity> findByLoanId(UUID loanId) {
        return loanAgreementRepository.findByLoanId(loanId);
    }

    @Transactional(readOnly = true)
    public LoanAgreementEntity getByLoanId(UUID loanId) {
        return loanAgreementRepository.findByLoanId(loanId)
                .orElseThrow(() -> new ResourceNotFoundException("Loan agreement not found for loan: " + loanId));
    }

    LoanAgreementEntity fromLoan(LoanEntity loan) {
        CreditorInfo creditor = loan.getCreditorInfo() != null ? loan.getCreditorInfo() : new CreditorInfo();
        CollateralDetails collateral = loan.getCollateralDetails() != null ? loan.getCollateralDetails() : new CollateralDetails();
        Signatory bond1 = guarantor(loan.getGuarantors(), 0);
        Signatory bond2 = guarantor(loan.getGuarantors(), 1);

        String collateralText = loan.getCollateralItemsText() != null && !loan.getCollateralItemsText().isBlank()
                ? loan.getCollateralItemsText()
                : collateral.getPropertyGiven();

        return LoanAgreementEntity.builder()
                .loanId(loan.getId())
                .branchName(loan.getBranchName())
                .branchCode(loan.getBranchCode())
                .loanOfficerName(loan.getLoanOfficerName())
                .currency(loan.getCurrency())
                .formNumber(loan.getFormNumber())
                .dateOfCredit(loan.getDisbursementDate())
                .cashAmountCredited(loan.getCashAmountCredited())
                .amountInWords(loan.getLoanAmountInWords())
                .purposeOfLoan(loan.getPurposeOfLoan())
                .interestDeductedOrAdded(loan.getInterestDeductedOrAdded() != null
                        ? loan.getInterestDeductedOrAdded()
                        : calculator.plannedInterest(loan))
                .totalAmountToBePaid(loan.getTotalAmountToBePaid())
                .nameOfCreditor(creditor.getNameOfCreditor())
                .creditorSex(creditor.getCreditorSex())
                .creditorContacts(creditor.getCreditorContacts())
                .typeOfBusinessOrJob(creditor.getTypeOfBusinessOrJob() != null
                        ? creditor.getTypeOfBusinessOrJob()
                        : loan.getBusinessType())
                .presentAddress(creditor.getHomeAddress())
                .businessAddress(creditor.getBusinessAddress())
                .collateralItemsText(collateralText)
                .collateralItemsLocation(collateral.getPropertyLocation())
                .bondsperson1Name(bond1 == null ? null : bond1.getName())
                .bondsperson1Contacts(bond1 == null ? null : bond1.getCellphoneNumber())
                .bondsperson2Name(bond2 == null ? null : bond2.getName())
                .bondsperson2Contacts(bond2 == null ? null : bond2.getCellphoneNumber())
                .attestedBy(loan.getAttestedBy())
                .approvedBy(loan.getApprovedBy())
                .build();
    }

    private static Signatory guarantor(List<Signatory> guarantors, int index) {
        return guarantors != null && guarantors.size() > index ? guarantors.get(index) : null;
    }
}
