package com.microfinance.domain.service;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.CollateralDetails;
import com.microfinance.infrastructure.persistence.entity.LoanAgreementEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.Signatory;
import com.microfinance.infrastructure.persistence.repository.LoanAgreementRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoanAgreementServiceTest {

    @Mock private LoanAgreementRepository loanAgreementRepository;

    private LoanAgreementService agreementService;

    @BeforeEach
    void setUp() {
        agreementService = new LoanAgreementService(loanAgreementRepository, new FeeScheduleCalculator());
    }

    @Test
    void ensureAgreement_returnsExistingAgreement() {
        LoanEntity loan = activeLoan();
        LoanAgreementEntity existing = LoanAgreementEntity.builder().id(UUID.randomUUID()).loanId(loan.getId()).build();
        when(loanAgreementRepository.findByLoanId(loan.getId())).thenReturn(Optional.of(existing));

        assertSame(existing, agreementService.ensureAgreement(loan));
        verify(loanAgreementRepository, never()).saveAndFlush(any());
    }

    @Test
    void ensureAgreement_generatesAgreementFromLoanSnapshot() {
        LoanEntity loan = activeLoan();
        when(loanAgreementRepository.findByLoanId(loan.getId())).thenReturn(Optional.empty());
        when(loanAgreementRepository.saveAndFlush(any(LoanAgreementEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        LoanAgreementEntity agreement = agreementService.ensureAgreement(loan);

        assertEquals(loan.getId(), agreement.getLoanId());
        assertEquals("MON", agreement.getBranchCode());
        assertEquals(new BigDecimal("9100.00"), agreement.getCashAmountCredited());
        assertEquals(new BigDecimal("1000.00"), agreement.getInterestDeductedOrAdded());
        assertEquals("Comfort Doe", agreement.getBondsperson1Name());
        assertNull(agreement.getBondsperson2Name());
        assertEquals("Generator", agreement.getCollateralItemsText());
        assertEquals(LocalDate.of(2024, 2, 1), agreement.getDateOfCredit());
    }

    @Test
    void getByLoanId_missingAgreementIsNotFound() {
        UUID loanId = UUID.randomUUID();
        when(loanAgreementRepository.findByLoanId(loanId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> agreementService.getByLoanId(loanId));
    }

    private static LoanEntity activeLoan() {
        return LoanEntity.builder()
                .id(UUID.randomUUID())
                .branchName("Monrovia Central")
                .branchCode("MON")
                .loanOfficerName("jkollie")
                .category(LoanCategory.INDIVIDUAL)
                .clientId(UUID.randomUUID())
                .status(LoanStatus.ACTIVE)
                .loanAmount(new BigDecimal("10000"))
                .interestRate(new BigDecimal("10"))
                .totalAmountToBePaid(new BigDecimal("11000.00"))
                .cashAmountCredited(new BigDecimal("9100.00"))
                .currency(Currency.LRD)
                .disbursementDate(LocalDate.of(2024, 2, 1))
                .guarantors(List.of(Signatory.builder().name("Comfort Doe").cellphoneNumber("0770000000").build()))
                .collateralDetails(CollateralDetails.builder().propertyGiven("Generator").build())
                .build();
    }
}
