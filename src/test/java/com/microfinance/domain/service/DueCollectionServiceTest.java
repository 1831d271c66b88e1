package com.microfinance.domain.service;

import com.microfinance.api.dto.DueCollectionItem;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.PaymentPlan;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DueCollectionServiceTest {

    @Mock private LoanRepository loanRepository;

    private DueCollectionService dueCollectionService;

    @BeforeEach
    void setUp() {
        dueCollectionService = new DueCollectionService(loanRepository, new FeeScheduleCalculator(), new LoanAccessPolicy());
    }

    @Test
    void dueCollections_listsInstallmentsInWindowWithArrears() {
        LoanEntity loan = activeLoan("officer@mfi.lr");
        loan.setTotalRealization(new BigDecimal("500"));
        when(loanRepository.findByStatus(LoanStatus.ACTIVE)).thenReturn(List.of(loan));

        List<DueCollectionItem> items = dueCollectionService.dueCollections(
                LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 22), null, null);

        assertEquals(2, items.size());
        DueCollectionItem second = items.get(0);
        assertEquals(LocalDate.of(2024, 1, 15), second.getDueDate());
        assertEquals(1, second.getPeriodIndex());
        assertEquals(4, second.getPeriodCount());
        assertEquals(new BigDecimal("550.00"), second.getScheduledAmount());
        assertEquals(new BigDecimal("1100.00"), second.getExpectedToDate());
        assertEquals(new BigDecimal("600.00"), second.getArrears());

        DueCollectionItem third = items.get(1);
        assertEquals(new BigDecimal("1650.00"), third.getExpectedToDate());
        assertEquals(new BigDecimal("1150.00"), third.getArrears());
    }

    @Test
    void dueCollections_arrearsNeverNegative() {
        LoanEntity loan = activeLoan("officer@mfi.lr");
        loan.setTotalRealization(new BigDecimal("2200"));
        when(loanRepository.findByStatus(LoanStatus.ACTIVE)).thenReturn(List.of(loan));

        List<DueCollectionItem> items = dueCollectionService.dueCollections(
                LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 8), null, null);

        assertEquals(1, items.size());
        assertEquals(new BigDecimal("0.00"), items.get(0).getArrears());
    }

    @Test
    void dueCollections_restrictedUserSeesOwnLoansOnly() {
        LoanEntity own = activeLoan("officer@mfi.lr");
        LoanEntity other = activeLoan("someone@mfi.lr");
        other.setLoanOfficerName("pdoe");
        when(loanRepository.findByStatus(LoanStatus.ACTIVE)).thenReturn(List.of(own, other));
        UserIdentity officer = UserIdentity.builder().email("Officer@MFI.lr").username("mkollie").role("loan officer").build();

        List<DueCollectionItem> items = dueCollectionService.dueCollections(
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), null, officer);

        assertEquals(4, items.size());
        assertTrue(items.stream().allMatch(i -> i.getLoanId().equals(own.getId())));
    }

    @Test
    void dueCollections_rejectsInvertedWindow() {
        assertThrows(LoanValidationException.class, () -> dueCollectionService.dueCollections(
                LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1), null, null));
        verifyNoInteractions(loanRepository);
    }

    private static LoanEntity activeLoan(String createdBy) {
        return LoanEntity.builder()
                .id(UUID.randomUUID())
                .branchName("Monrovia Central")
                .branchCode("MON")
                .loanOfficerName("jkollie")
                .createdByEmail(createdBy)
                .category(LoanCategory.INDIVIDUAL)
                .clientId(UUID.randomUUID())
                .status(LoanStatus.ACTIVE)
                .loanAmount(new BigDecimal("2000"))
                .interestRate(new BigDecimal("10"))
                .currency(Currency.LRD)
                .paymentPlan(PaymentPlan.WEEKLY)
                .loanDurationNumber(4)
                .loanDurationUnit(DurationUnit.WEEKS)
                .disbursementDate(LocalDate.of(2024, 1, 1))
                .build();
    }
}
