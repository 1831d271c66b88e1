package com.microfinance.domain.service;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.MetricName;
import com.microfinance.infrastructure.persistence.entity.CollateralDetails;
import com.microfinance.infrastructure.persistence.entity.CollectionEntry;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LoanMetricEventsTest {

    private LoanMetricEvents events;

    @BeforeEach
    void setUp() {
        events = new LoanMetricEvents(new FeeScheduleCalculator());
    }

    @Test
    void creation_emitsNonZeroFeeEventsOnDisbursementDate() {
        LoanEntity loan = loan(LoanCategory.INDIVIDUAL);
        loan.setCollateralDetails(CollateralDetails.builder().propertyValue(new BigDecimal("25000")).build());
        loan.setCollateralCashAmount(new BigDecimal("1000.00"));
        loan.setFormFeeAmount(new BigDecimal("500.00"));
        loan.setInspectionFeeAmount(BigDecimal.ZERO);
        loan.setProcessingFeeAmount(new BigDecimal("400.00"));

        Map<MetricName, BigDecimal> values = byMetric(events.creation(loan));

        assertEquals(4, values.size());
        assertEquals(new BigDecimal("25000.00"), values.get(MetricName.TOTAL_COLLATERAL));
        assertEquals(new BigDecimal("400.00"), values.get(MetricName.TOTAL_PROCESSING_FEES));
        assertFalse(values.containsKey(MetricName.TOTAL_INSPECTION_FEES));
        assertEquals(LocalDate.of(2024, 2, 1), events.creation(loan).get(0).getEventDate());
        assertEquals("individual", events.creation(loan).get(0).getExtra().get("loanType"));
    }

    @Test
    void activation_groupLoanOnlyBooksInterest() {
        LoanEntity loan = loan(LoanCategory.GROUP);

        Map<MetricName, BigDecimal> values = byMetric(events.activation(loan));

        assertEquals(1, values.size());
        assertEquals(new BigDecimal("1000.00"), values.get(MetricName.INTEREST_COLLECTED));
    }

    @Test
    void activation_individualLoanBooksDisbursementAndWaitingBalance() {
        LoanEntity loan = loan(LoanCategory.INDIVIDUAL);
        loan.setNetDisbursedAmount(new BigDecimal("9100.00"));

        Map<MetricName, BigDecimal> values = byMetric(events.activation(loan));

        assertEquals(new BigDecimal("1000.00"), values.get(MetricName.INTEREST_COLLECTED));
        assertEquals(new BigDecimal("9100.00"), values.get(MetricName.LOAN_AMOUNT_DISTRIBUTED));
        assertEquals(new BigDecimal("10000.00"), values.get(MetricName.WAITING_TO_BE_COLLECTED));
    }

    @Test
    void collection_booksShortfallAsOverdue() {
        LoanEntity loan = loan(LoanCategory.INDIVIDUAL);
        CollectionEntry entry = CollectionEntry.builder()
                .scheduledAmount(new BigDecimal("550"))
                .collectedAmount(new BigDecimal("300"))
                .collectionDate(LocalDate.of(2024, 2, 8))
                .build();

        List<MetricEventPayload> result = events.collection(loan, entry, 2);
        Map<MetricName, BigDecimal> values = byMetric(result);

        assertEquals(new BigDecimal("300.00"), values.get(MetricName.TOTAL_COLLECTIONS_COLLECTED));
        assertEquals(new BigDecimal("-300.00"), values.get(MetricName.WAITING_TO_BE_COLLECTED));
        assertEquals(new BigDecimal("250.00"), values.get(MetricName.OVERDUE));
        assertEquals(2, result.get(0).getExtra().get("collectionIdx"));
        assertEquals(LocalDate.of(2024, 2, 8), result.get(0).getEventDate());
    }

    @Test
    void collection_fullPaymentHasNoOverdueEvent() {
        LoanEntity loan = loan(LoanCategory.INDIVIDUAL);
        CollectionEntry entry = CollectionEntry.builder()
                .scheduledAmount(new BigDecimal("550"))
                .collectedAmount(new BigDecimal("600"))
                .collectionDate(LocalDate.of(2024, 2, 8))
                .build();

        assertFalse(byMetric(events.collection(loan, entry, 0)).containsKey(MetricName.OVERDUE));
    }

    @Test
    void distribution_groupLoanCarriesInterestOnWaitingBalance() {
        LoanEntity loan = loan(LoanCategory.GROUP);
        loan.setInterestRate(new BigDecimal("3"));
        DistributionEntity distribution = DistributionEntity.builder()
                .id(UUID.randomUUID())
                .loanId(loan.getId())
                .amount(new BigDecimal("5000"))
                .distributionDate(LocalDate.of(2024, 2, 5))
                .build();

        List<MetricEventPayload> created = events.distribution(loan, distribution, new BigDecimal("5000"), "create");
        Map<MetricName, BigDecimal> values = byMetric(created);

        assertEquals(new BigDecimal("5000.00"), values.get(MetricName.LOAN_AMOUNT_DISTRIBUTED));
        assertEquals(new BigDecimal("5150.00"), values.get(MetricName.WAITING_TO_BE_COLLECTED));
        assertEquals(distribution.getId(), created.get(0).getDistributionId());

        Map<MetricName, BigDecimal> deleted = byMetric(
                events.distribution(loan, distribution, new BigDecimal("-5000"), "delete"));
        assertEquals(new BigDecimal("-5150.00"), deleted.get(MetricName.WAITING_TO_BE_COLLECTED));
    }

    @Test
    void distribution_withoutLoanFallsBackToDistributionDimensions() {
        DistributionEntity distribution = DistributionEntity.builder()
                .loanId(UUID.randomUUID())
                .amount(new BigDecimal("700"))
                .currency(Currency.USD)
                .branchCode("GBA")
                .distributionDate(LocalDate.of(2024, 2, 5))
                .build();

        List<MetricEventPayload> result = events.distribution(null, distribution, new BigDecimal("-700"), "delete");

        assertEquals(2, result.size());
        assertEquals("GBA", result.get(0).getBranchCode());
        assertEquals(Currency.USD, result.get(0).getCurrency());
        assertEquals(new BigDecimal("-700.00"), result.get(1).getValue());
    }

    @Test
    void reversal_negatesAndTagsEvents() {
        LoanEntity loan = loan(LoanCategory.INDIVIDUAL);
        loan.setProcessingFeeAmount(new BigDecimal("400.00"));

        List<MetricEventPayload> reversed = events.reversal(events.creation(loan));

        assertEquals(1, reversed.size());
        assertEquals(new BigDecimal("-400.00"), reversed.get(0).getValue());
        assertEquals(Boolean.TRUE, reversed.get(0).getExtra().get("reversal"));
        assertEquals("creation", reversed.get(0).getExtra().get("type"));
    }

    private static LoanEntity loan(LoanCategory category) {
        return LoanEntity.builder()
                .id(UUID.randomUUID())
                .branchName("Monrovia Central")
                .branchCode("MON")
                .loanOfficerName("jkollie")
                .category(category)
                .status(LoanStatus.ACTIVE)
                .loanAmount(new BigDecimal("10000"))
                .interestRate(new BigDecimal("10"))
                .currency(Currency.LRD)
                .disbursementDate(LocalDate.of(2024, 2, 1))
                .build();
    }

    private static Map<MetricName, BigDecimal> byMetric(List<MetricEventPayload> payloads) {
        Map<MetricName, BigDecimal> values = new LinkedHashMap<>();
        for (MetricEventPayload payload : payloads) {
            values.merge(payload.getMetric(), payload.getValue(), BigDecimal::add);
        }
        return values;
    }
}
