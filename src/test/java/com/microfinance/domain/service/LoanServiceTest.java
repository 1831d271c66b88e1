package com.microfinance.domain.service;

import com.microfinance.api.dto.LoanRequest;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.EffectiveLoanConfig;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.MetricName;
import com.microfinance.domain.model.PaymentPlan;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.ForbiddenOperationException;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.Signatory;
import com.microfinance.infrastructure.persistence.repository.DistributionRepository;
import com.microfinance.infrastructure.persistence.repository.GroupRepository;
import com.microfinance.infrastructure.persistence.repository.LoanAgreementRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import com.microfinance.infrastructure.persistence.repository.OutboxEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoanServiceTest {

    @Mock private LoanRepository loanRepository;
    @Mock private GroupRepository groupRepository;
    @Mock private DistributionRepository distributionRepository;
    @Mock private LoanAgreementRepository loanAgreementRepository;
    @Mock private OutboxEventRepository outboxEventRepository;
    @Mock private LoanConfigResolver loanConfigResolver;
    @Mock private MetricOutboxWriter metricOutboxWriter;
    @Mock private MetricEventService metricEventService;
    @Mock private GroupLoanTotalService groupLoanTotalService;

    private SimpleMeterRegistry meterRegistry;
    private LoanService loanService;

    private final UserIdentity officer = UserIdentity.builder()
            .email("mkollie@mfi.lr")
            .username("mkollie")
            .role("Loan Officer")
            .branchName("Monrovia Central")
            .branchCode("MON")
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        FeeScheduleCalculator calculator = new FeeScheduleCalculator();
        loanService = new LoanService(
                loanRepository,
                groupRepository,
                distributionRepository,
                loanAgreementRepository,
                outboxEventRepository,
                new LoanMapper(),
                new LoanValidator(),
                loanConfigResolver,
                calculator,
                new LoanMetricEvents(calculator),
                metricOutboxWriter,
                metricEventService,
                groupLoanTotalService,
                new LoanAccessPolicy(),
                new AfterCommitTasks(),
                meterRegistry
        );
    }

    @Test
    void create_restrictedOfficerGetsOwnBranchAndFeeEvents() {
        UUID id = UUID.randomUUID();
        when(loanConfigResolver.resolve("MON")).thenReturn(EffectiveLoanConfig.empty());
        when(loanRepository.save(any(LoanEntity.class))).thenAnswer(inv -> {
            LoanEntity loan = inv.getArgument(0);
            loan.setId(id);
            return loan;
        });
        LoanRequest request = individualRequest();
        request.setBranchName("Gbarnga");
        request.setBranchCode("GBA");

        LoanEntity created = loanService.create(request, officer);

        assertEquals(LoanStatus.PENDING, created.getStatus());
        assertEquals("MON", created.getBranchCode());
        assertEquals("Monrovia Central", created.getBranchName());
        assertEquals("mkollie", created.getLoanOfficerName());
        assertEquals("mkollie@mfi.lr", created.getCreatedByEmail());
        assertEquals(new BigDecimal("9100.00"), created.getNetDisbursedAmount());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MetricEventPayload>> events = ArgumentCaptor.forClass(List.class);
        verify(metricOutboxWriter).enqueue(eq(id.toString()), events.capture());
        assertEquals(new BigDecimal("400.00"), valueOf(events.getValue(), MetricName.TOTAL_PROCESSING_FEES));
        assertEquals(new BigDecimal("1000.00"), valueOf(events.getValue(), MetricName.COLLATERAL_CASH_REQUIRED));
        assertEquals(new BigDecimal("500.00"), valueOf(events.getValue(), MetricName.TOTAL_FORM_FEES));

        verifyNoInteractions(groupLoanTotalService);
        assertEquals(1.0, meterRegistry.counter("loan.created", "category", "individual").count());
    }

    @Test
    void create_individualWithoutGuarantorIsRejected() {
        LoanRequest request = individualRequest();
        request.setGuarantors(List.of());

        LoanValidationException ex = assertThrows(LoanValidationException.class,
                () -> loanService.create(request, null));

        assertTrue(ex.getFieldErrors().containsKey("guarantors"));
        verify(loanRepository, never()).save(any());
        verifyNoInteractions(metricOutboxWriter);
    }

    @Test
    void create_groupMemberLoanRefreshesGroupTotal() {
        UUID groupId = UUID.randomUUID();
        when(loanConfigResolver.resolve("MON")).thenReturn(EffectiveLoanConfig.empty());
        when(loanRepository.save(any(LoanEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        LoanRequest request = individualRequest();
        request.setGroupId(groupId);
        request.setGuarantors(List.of());

        loanService.create(request, null);

        verify(groupLoanTotalService).recalculate(groupId);
    }

    @Test
    void update_reversesPreviousFeesAndQueuesNewOnes() {
        when(loanConfigResolver.resolve("MON")).thenReturn(EffectiveLoanConfig.empty());
        LoanEntity loan = new LoanMapper().toEntity(individualRequest());
        loan.setId(UUID.randomUUID());
        loan.setStatus(LoanStatus.PENDING);
        loanService.prepare(loan);
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(loanRepository.save(loan)).thenReturn(loan);

        LoanRequest change = new LoanRequest();
        change.setLoanAmount(new BigDecimal("20000"));
        LoanEntity updated = loanService.update(loan.getId(), change, null);

        assertEquals(new BigDecimal("22000.00"), updated.getTotalAmountToBePaid());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MetricEventPayload>> events = ArgumentCaptor.forClass(List.class);
        verify(metricOutboxWriter).enqueue(eq(loan.getId().toString()), events.capture());
        List<BigDecimal> processing = events.getValue().stream()
                .filter(e -> e.getMetric() == MetricName.TOTAL_PROCESSING_FEES)
                .map(MetricEventPayload::getValue)
                .toList();
        assertEquals(List.of(new BigDecimal("-400.00"), new BigDecimal("800.00")), processing);
    }

    @Test
    void update_activeLoanIsRejected() {
        LoanEntity loan = new LoanMapper().toEntity(individualRequest());
        loan.setId(UUID.randomUUID());
        loan.setStatus(LoanStatus.ACTIVE);
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));

        assertThrows(LoanValidationException.class,
                () -> loanService.update(loan.getId(), new LoanRequest(), null));
        verify(loanRepository, never()).save(any());
    }

    @Test
    void delete_removesDependentsAndSupersedesQueuedEvents() {
        LoanEntity loan = new LoanMapper().toEntity(individualRequest());
        loan.setId(UUID.randomUUID());
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));

        loanService.delete(loan.getId(), null);

        verify(distributionRepository).deleteByLoanId(loan.getId());
        verify(loanAgreementRepository).deleteByLoanId(loan.getId());
        verify(outboxEventRepository).supersedeForAggregate(eq(loan.getId().toString()), anyCollection(), any());
        verify(metricEventService).purgeForLoan(loan.getId());
        verify(loanRepository).delete(loan);
    }

    @Test
    void get_foreignLoanIsForbiddenForOfficer() {
        LoanEntity loan = new LoanMapper().toEntity(individualRequest());
        loan.setId(UUID.randomUUID());
        loan.setCreatedByEmail("someone.else@mfi.lr");
        loan.setLoanOfficerName("pdoe");
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));

        assertThrows(ForbiddenOperationException.class, () -> loanService.get(loan.getId(), officer));
    }

    private static LoanRequest individualRequest() {
        return LoanRequest.builder()
                .branchName("Monrovia Central")
                .branchCode("MON")
                .loanOfficerName("jkollie")
                .category(LoanCategory.INDIVIDUAL)
                .clientId(UUID.randomUUID())
                .loanAmount(new BigDecimal("10000"))
                .interestRate(new BigDecimal("10"))
                .currency(Currency.LRD)
                .paymentPlan(PaymentPlan.WEEKLY)
                .loanDurationNumber(4)
                .guarantors(List.of(Signatory.builder().name("Comfort Doe").build()))
                .build();
    }

    private static BigDecimal valueOf(List<MetricEventPayload> events, MetricName metric) {
        return events.stream()
                .filter(e -> e.getMetric() == metric)
                .map(MetricEventPayload::getValue)
                .findFirst()
                .orElse(null);
    }
}
