package com.microfinance.domain.service;

import com.microfinance.api.dto.DistributionEntryRequest;
import com.microfinance.api.dto.DistributionRequest;
import com.microfinance.domain.model.CollectionStartRule;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.MetricName;
import com.microfinance.domain.model.PaymentPlan;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.DistributionRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DistributionLedgerServiceTest {

    @Mock private DistributionRepository distributionRepository;
    @Mock private LoanRepository loanRepository;
    @Mock private MetricOutboxWriter metricOutboxWriter;

    private MeterRegistry meterRegistry;
    private DistributionLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ledgerService = new DistributionLedgerService(
                distributionRepository,
                loanRepository,
                new LoanMetricEvents(new FeeScheduleCalculator()),
                metricOutboxWriter,
                new LoanAccessPolicy(),
                meterRegistry
        );
    }

    @Test
    void create_recordsTrancheAndAdjustsCollectionStart() {
        LoanEntity loan = activeGroupLoan();
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(distributionRepository.saveAll(any())).thenAnswer(inv -> inv.getArgument(0));

        DistributionRequest request = DistributionRequest.builder()
                .amount(new BigDecimal("5000"))
                .distributionDate(LocalDate.of(2024, 2, 5))
                .collectionStartRule(CollectionStartRule.NEXT_WEEK)
                .build();

        List<DistributionEntity> created = ledgerService.create(loan.getId(), request, null);

        assertEquals(1, created.size());
        DistributionEntity distribution = created.get(0);
        assertEquals(loan.getGroupId(), distribution.getGroupId());
        assertEquals(Currency.LRD, distribution.getCurrency());
        assertEquals("MON", distribution.getBranchCode());
        assertEquals(LocalDate.of(2024, 2, 12), loan.getCollectionStartDate());
        verify(loanRepository).save(loan);

        assertEquals(new BigDecimal("5150.00"), valueOf(captureEvents(loan), MetricName.WAITING_TO_BE_COLLECTED));
        assertEquals(1.0, meterRegistry.counter("loan.distributions", "operation", "create").count());
    }

    @Test
    void create_durationChangeClearsEndingDate() {
        LoanEntity loan = activeGroupLoan();
        loan.setEndingDate(LocalDate.of(2024, 3, 1));
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(distributionRepository.saveAll(any())).thenAnswer(inv -> inv.getArgument(0));

        ledgerService.create(loan.getId(), DistributionRequest.builder()
                .amount(new BigDecimal("1000"))
                .loanDurationNumber(12)
                .loanDurationUnit(DurationUnit.WEEKS)
                .build(), null);

        assertNull(loan.getEndingDate());
        assertEquals(12, loan.getLoanDurationNumber());
        verify(loanRepository).save(loan);
    }

    @Test
    void create_singleClientLoanForcesMember() {
        LoanEntity loan = activeGroupLoan();
        loan.setCategory(LoanCategory.INDIVIDUAL);
        loan.setClientId(UUID.randomUUID());
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(distributionRepository.saveAll(any())).thenAnswer(inv -> inv.getArgument(0));

        List<DistributionEntity> created = ledgerService.create(loan.getId(), DistributionRequest.builder()
                .amount(new BigDecimal("1000"))
                .memberId(UUID.randomUUID())
                .build(), null);

        assertEquals(loan.getClientId(), created.get(0).getMemberId());
        assertEquals(LocalDate.now(), created.get(0).getDistributionDate());
        verify(loanRepository, never()).save(any());
    }

    @Test
    void create_requiresActiveLoan() {
        LoanEntity loan = activeGroupLoan();
        loan.setStatus(LoanStatus.PENDING);
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));

        assertThrows(LoanValidationException.class, () -> ledgerService.create(loan.getId(),
                DistributionRequest.builder().amount(new BigDecimal("1000")).build(), null));
        verifyNoInteractions(distributionRepository, metricOutboxWriter);
    }

    @Test
    void create_rejectsForeignCurrencyTranche() {
        LoanEntity loan = activeGroupLoan();
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));

        DistributionRequest request = DistributionRequest.builder()
                .entries(new ArrayList<>(List.of(
                        DistributionEntryRequest.builder().amount(new BigDecimal("1000")).build(),
                        DistributionEntryRequest.builder().amount(new BigDecimal("50")).currency(Currency.USD).build())))
                .build();

        LoanValidationException ex = assertThrows(LoanValidationException.class,
                () -> ledgerService.create(loan.getId(), request, null));

        assertTrue(ex.getFieldErrors().containsKey("entries[1].currency"));
        verifyNoInteractions(distributionRepository);
    }

    @Test
    void update_queuesOnlyTheAmountDelta() {
        LoanEntity loan = activeGroupLoan();
        DistributionEntity distribution = distribution(loan, new BigDecimal("5000.00"));
        when(distributionRepository.findById(distribution.getId())).thenReturn(Optional.of(distribution));
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(distributionRepository.save(distribution)).thenReturn(distribution);

        ledgerService.update(distribution.getId(),
                DistributionEntryRequest.builder().amount(new BigDecimal("6000")).build(), null);

        List<MetricEventPayload> events = captureEvents(loan);
        assertEquals(new BigDecimal("1000.00"), valueOf(events, MetricName.LOAN_AMOUNT_DISTRIBUTED));
        assertEquals(new BigDecimal("1030.00"), valueOf(events, MetricName.WAITING_TO_BE_COLLECTED));
        assertEquals("update", events.get(0).getExtra().get("operation"));
    }

    @Test
    void update_notesOnlyQueuesNothing() {
        LoanEntity loan = activeGroupLoan();
        DistributionEntity distribution = distribution(loan, new BigDecimal("5000.00"));
        when(distributionRepository.findById(distribution.getId())).thenReturn(Optional.of(distribution));
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(distributionRepository.save(distribution)).thenReturn(distribution);

        DistributionEntity updated = ledgerService.update(distribution.getId(),
                DistributionEntryRequest.builder().notes("second tranche").build(), null);

        assertEquals("second tranche", updated.getNotes());
        verifyNoInteractions(metricOutboxWriter);
    }

    @Test
    void delete_reversesAmountEvenWhenLoanIsGone() {
        LoanEntity loan = activeGroupLoan();
        DistributionEntity distribution = distribution(loan, new BigDecimal("700.00"));
        when(distributionRepository.findById(distribution.getId())).thenReturn(Optional.of(distribution));
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.empty());

        ledgerService.delete(distribution.getId(), null);

        verify(distributionRepository).delete(distribution);
        List<MetricEventPayload> events = captureEvents(loan);
        assertEquals(new BigDecimal("-700.00"), valueOf(events, MetricName.LOAN_AMOUNT_DISTRIBUTED));
        assertEquals(new BigDecimal("-700.00"), valueOf(events, MetricName.WAITING_TO_BE_COLLECTED));
    }

    private List<MetricEventPayload> captureEvents(LoanEntity loan) {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MetricEventPayload>> captor = ArgumentCaptor.forClass(List.class);
        verify(metricOutboxWriter).enqueue(eq(loan.getId().toString()), captor.capture());
        return captor.getValue();
    }

    private static BigDecimal valueOf(List<MetricEventPayload> events, MetricName metric) {
        return events.stream()
                .filter(e -> e.getMetric() == metric)
                .map(MetricEventPayload::getValue)
                .findFirst()
                .orElse(null);
    }

    private static DistributionEntity distribution(LoanEntity loan, BigDecimal amount) {
        return DistributionEntity.builder()
                .id(UUID.randomUUID())
                .loanId(loan.getId())
                .groupId(loan.getGroupId())
                .amount(amount)
                .currency(Currency.LRD)
                .branchName(loan.getBranchName())
                .branchCode(loan.getBranchCode())
                .distributionDate(LocalDate.of(2024, 2, 5))
                .build();
    }

    private static LoanEntity activeGroupLoan() {
        return LoanEntity.builder()
                .id(UUID.randomUUID())
                .branchName("Monrovia Central")
                .branchCode("MON")
                .loanOfficerName("jkollie")
                .category(LoanCategory.GROUP)
                .groupId(UUID.randomUUID())
                .status(LoanStatus.ACTIVE)
                .loanAmount(new BigDecimal("20000"))
                .interestRate(new BigDecimal("3"))
                .currency(Currency.LRD)
                .paymentPlan(PaymentPlan.WEEKLY)
                .loanDurationNumber(8)
                .loanDurationUnit(DurationUnit.WEEKS)
                .build();
    }
}
