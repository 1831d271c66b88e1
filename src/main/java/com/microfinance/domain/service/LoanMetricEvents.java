package com.microfinance.domain.service;

import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.MetricName;
import com.microfinance.domain.model.Money;
import com.microfinance.infrastructure.persistence.entity.CollectionEntry;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the metric events a loan produces at each point of its life.
 *
 * Live ledger mutations and the recalculation replay both go through here,
 * so a rebuilt store matches what the live path would have written.
 * Zero-valued events are never produced.
 */
@Component
@RequiredArgsConstructor
public class LoanMetricEvents {

    private final FeeScheduleCalculator calculator;

    public List<MetricEventPayload> creation(LoanEntity loan) {
        LocalDate date = creationDate(loan);
        Map<String, Object> extra = extra("creation");
        extra.put("loanType", loan.getCategory() == null ? null : loan.getCategory().getWireName());

        List<MetricEventPayload> events = new ArrayList<>();
        add(events, loan, MetricName.TOTAL_COLLATERAL, calculator.collateralValue(loan), date, extra);
        add(events, loan, MetricName.COLLATERAL_CASH_REQUIRED, loan.getCollateralCashAmount(), date, extra);
        add(events, loan, MetricName.TOTAL_FORM_FEES, loan.getFormFeeAmount(), date, extra);
        add(events, loan, MetricName.TOTAL_INSPECTION_FEES, loan.getInspectionFeeAmount(), date, extra);
        add(events, loan, MetricName.TOTAL_PROCESSING_FEES, loan.getProcessingFeeAmount(), date, extra);
        return events;
    }

    /**
     * Planned interest, and for non-group loans the disbursement and the opening
     * waiting balance. Group loans disburse through distributions instead.
     */
    public List<MetricEventPayload> activation(LoanEntity loan) {
        LocalDate date = activationDate(loan);
        Map<String, Object> extra = extra("activation");

        List<MetricEventPayload> events = new ArrayList<>();
        add(events, loan, MetricName.INTEREST_COLLECTED, calculator.plannedInterest(loan), date, extra);
        if (loan.getCategory() != LoanCategory.GROUP) {
            BigDecimal disbursed = Money.isPositive(loan.getNetDisbursedAmount())
                    ? loan.getNetDisbursedAmount()
                    : loan.getLoanAmount();
            add(events, loan, MetricName.LOAN_AMOUNT_DISTRIBUTED, disbursed, date, extra);
            add(events, loan, MetricName.WAITING_TO_BE_COLLECTED, loan.getLoanAmount(), date, extra);
        }
        return events;
    }

    public List<MetricEventPayload> collateralDeposit(LoanEntity loan, BigDecimal amount) {
        List<MetricEventPayload> events = new ArrayList<>();
        add(events, loan, MetricName.COLLATERAL_CASH_DEPOSITED, amount, activationDate(loan), extra("activation"));
        return events;
    }

    /**
     * Collected amount, the matching drop in the waiting balance and any shortfall.
     */
    public List<MetricEventPayload> collection(LoanEntity loan, CollectionEntry entry, int index) {
        LocalDate date = entry.getCollectionDate() != null ? entry.getCollectionDate() : LocalDate.now();
        Map<String, Object> extra = extra("collection");
        extra.put("collectionIdx", index);

        BigDecimal collected = Money.orZero(entry.getCollectedAmount());
        List<MetricEventPayload> events = new ArrayList<>();
        add(events, loan, MetricName.TOTAL_COLLECTIONS_COLLECTED, collected, date, extra);
        add(events, loan, MetricName.WAITING_TO_BE_COLLECTED, collected.negate(), date, extra);
        add(events, loan, MetricName.OVERDUE, entry.overdueAmount(), date, extra);
        return events;
    }

    public List<MetricEventPayload> collections(LoanEntity loan) {
        List<MetricEventPayload> events = new ArrayList<>();
        List<CollectionEntry> entries = loan.getCollections();
        for (int i = 0; i < entries.size(); i++) {
            events.addAll(collection(loan, entries.get(i), i));
        }
        return events;
    }

    /**
     * Events for a change of {@code delta} in a distribution's amount. Creation passes
     * the full amount, deletion its negation. The waiting balance of a group loan
     * carries the interest share.
     *
     * @param loan parent loan, may be null when it no longer exists
     */
    public List<MetricEventPayload> distribution(LoanEntity loan, DistributionEntity distribution,
                                                 BigDecimal delta, String operation) {
        LocalDate date = distribution.getDistributionDate() != null ? distribution.getDistributionDate() : LocalDate.now();
        Map<String, Object> extra = extra("distribution");
        extra.put("operation", operation);
        extra.put("distribution", distribution.getId() == null ? null : distribution.getId().toString());

        MetricEventPayload base = MetricEventPayload.builder()
                .eventDate(date)
                .branchName(loan != null ? loan.getBranchName() : distribution.getBranchName())
                .branchCode(loan != null ? loan.getBranchCode() : distribution.getBranchCode())
                .loanOfficerName(loan != null ? loan.getLoanOfficerName() : null)
                .currency(loan != null ? loan.getCurrency() : distribution.getCurrency())
                .loanId(distribution.getLoanId())
                .groupId(loan != null && loan.getGroupId() != null ? loan.getGroupId() : distribution.getGroupId())
                .clientId(loan != null ? loan.getClientId() : null)
                .distributionId(distribution.getId())
                .build();

        List<MetricEventPayload> events = new ArrayList<>();
        addFrom(events, base, MetricName.LOAN_AMOUNT_DISTRIBUTED, Money.round2(delta), extra);
        addFrom(events, base, MetricName.WAITING_TO_BE_COLLECTED, calculator.waitingAmountForDistribution(loan, delta), extra);
        return events;
    }

    /**
     * Negated copies of {@code events}, tagged as a reversal.
     */
    public List<MetricEventPayload> reversal(List<MetricEventPayload> events) {
        List<MetricEventPayload> reversed = new ArrayList<>(events.size());
        for (MetricEventPayload event : events) {
            Map<String, Object> extra = new LinkedHashMap<>(event.getExtra());
            extra.put("reversal", true);
            reversed.add(event.toBuilder()
                    .value(event.getValue().negate())
                    .extra(extra)
                    .build());
        }
        return reversed;
    }

    LocalDate creationDate(LoanEntity loan) {
        if (loan.getDisbursementDate() != null) {
            return loan.getDisbursementDate();
        }
        if (loan.getCreatedAt() != null) {
            return loan.getCreatedAt().atZone(ZoneOffset.UTC).toLocalDate();
        }
        return LocalDate.now();
    }

    LocalDate activationDate(LoanEntity loan) {
        if (loan.getDisbursementDate() != null) {
            return loan.getDisbursementDate();
        }
        if (loan.getUpdatedAt() != null) {
            return loan.getUpdatedAt().atZone(ZoneOffset.UTC).toLocalDate();
        }
        return creationDate(loan);
    }

    private void add(List<MetricEventPayload> events, LoanEntity loan, MetricName metric,
                     BigDecimal value, LocalDate date, Map<String, Object> extra) {
        MetricEventPayload base = MetricEventPayload.builder()
                .eventDate(date)
                .branchName(loan.getBranchName())
                .branchCode(loan.getBranchCode())
                .loanOfficerName(loan.getLoanOfficerName())
                .currency(loan.getCurrency())
                .loanId(loan.getId())
                .groupId(loan.getGroupId())
                .clientId(loan.getClientId())
                .build();
        addFrom(events, base, metric, Money.round2(value), extra);
    }

    private void addFrom(List<MetricEventPayload> events, MetricEventPayload base, MetricName metric,
                         BigDecimal value, Map<String, Object> extra) {
        if (value == null || value.signum() == 0) {
            return;
        }
        events.add(base.toBuilder()
                .metric(metric)
                .value(value)
                .extra(new LinkedHashMap<>(extra))
                .build());
    }

    private static Map<String, Object> extra(String type) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("type", type);
        return extra;
    }
}
