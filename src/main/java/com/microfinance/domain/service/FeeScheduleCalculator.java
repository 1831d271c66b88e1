package com.microfinance.domain.service;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.domain.model.EffectiveLoanConfig;
import com.microfinance.domain.model.FeeBreakdown;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.Money;
import com.microfinance.domain.model.PaymentPlan;
import com.microfinance.domain.model.RepaymentSchedule;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.LoanTypeConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fee and repayment-schedule calculations.
 *
 * Everything here is a pure function of the loan's terms and the effective
 * fee configuration. Built-in fallbacks apply wherever the configuration is silent:
 * <ul>
 *   <li>processing fee: 3% group, 3% individual in a group, 4% standalone individual</li>
 *   <li>collateral cash: 8% group, 10% individual</li>
 *   <li>form fee (LRD only): 200 group, 500 new individual, 400 returning individual</li>
 * </ul>
 */
@Component
public class FeeScheduleCalculator {

    static final BigDecimal GROUP_PROCESSING_PERCENT = BigDecimal.valueOf(3);
    static final BigDecimal GROUP_MEMBER_PROCESSING_PERCENT = BigDecimal.valueOf(3);
    static final BigDecimal INDIVIDUAL_PROCESSING_PERCENT = BigDecimal.valueOf(4);
    static final BigDecimal GROUP_COLLATERAL_PERCENT = BigDecimal.valueOf(8);
    static final BigDecimal INDIVIDUAL_COLLATERAL_PERCENT = BigDecimal.valueOf(10);
    static final BigDecimal GROUP_FORM_FEE_LRD = BigDecimal.valueOf(200);
    static final BigDecimal NEW_INDIVIDUAL_FORM_FEE_LRD = BigDecimal.valueOf(500);
    static final BigDecimal RETURNING_INDIVIDUAL_FORM_FEE_LRD = BigDecimal.valueOf(400);

    /** Upper bound on generated due dates. */
    static final int MAX_SCHEDULE_ITERATIONS = 500;

    /**
     * Fill in configuration defaults and recompute every derived amount on the loan.
     *
     * Percentages and fee inputs are only defaulted when absent; processing fee,
     * collateral cash and net disbursed amounts are always recomputed.
     */
    public FeeBreakdown deriveFields(LoanEntity loan, EffectiveLoanConfig config) {
        LoanCategory category = loan.getCategory();
        LoanTypeConfig typeConfig = config.forCategory(category);
        boolean feeBearing = category == LoanCategory.GROUP || category == LoanCategory.INDIVIDUAL;

        if (loan.getProcessingFeePercent() == null) {
            loan.setProcessingFeePercent(firstNonNull(typeConfig.getProcessingFeePercent(), fallbackProcessingPercent(loan)));
        }
        if (loan.getCollateralCashPercent() == null && feeBearing) {
            loan.setCollateralCashPercent(firstNonNull(typeConfig.getCollateralCashPercent(),
                    category == LoanCategory.INDIVIDUAL ? INDIVIDUAL_COLLATERAL_PERCENT : GROUP_COLLATERAL_PERCENT));
        }

        if (loan.getCurrency() != null && !loan.getCurrency().isLocal()) {
            loan.setFormFeeAmount(Money.ZERO);
        } else if (loan.getFormFeeAmount() == null) {
            loan.setFormFeeAmount(feeBearing ? defaultFormFee(loan, config) : Money.ZERO);
        }

        if (loan.getInspectionFeeAmount() == null) {
            loan.setInspectionFeeAmount(Money.round2(typeConfig.getInspectionFeeDefault()));
        }

        BigDecimal principal = Money.orZero(loan.getLoanAmount());
        BigDecimal processingFee = Money.percentOf(principal, loan.getProcessingFeePercent());
        BigDecimal collateralCash = Money.percentOf(principal, loan.getCollateralCashPercent());
        BigDecimal formFee = Money.round2(loan.getFormFeeAmount());
        BigDecimal inspectionFee = Money.round2(loan.getInspectionFeeAmount());
        BigDecimal net = Money.round2(principal.subtract(processingFee).subtract(formFee).subtract(inspectionFee));

        loan.setProcessingFeeAmount(processingFee);
        loan.setCollateralCashAmount(collateralCash);
        loan.setFormFeeAmount(formFee);
        loan.setInspectionFeeAmount(inspectionFee);
        loan.setNetDisbursedAmount(net);

        if (loan.getTotalAmountToBePaid() == null) {
            loan.setTotalAmountToBePaid(Money.withInterest(principal, loan.getInterestRate()));
        }
        if (loan.getCashAmountCredited() == null) {
            loan.setCashAmountCredited(net);
        }
        if (loan.getEndingDate() == null && loan.getDisbursementDate() != null
                && loan.getLoanDurationNumber() != null && loan.getLoanDurationUnit() != null) {
            loan.setEndingDate(addDuration(loan.getDisbursementDate(), loan.getLoanDurationNumber(), loan.getLoanDurationUnit()));
        }

        return FeeBreakdown.builder()
                .processingFeePercent(loan.getProcessingFeePercent())
                .processingFeeAmount(processingFee)
                .collateralCashPercent(loan.getCollateralCashPercent())
                .collateralCashAmount(collateralCash)
                .formFeeAmount(formFee)
                .inspectionFeeAmount(inspectionFee)
                .netDisbursedAmount(net)
                .build();
    }

    private BigDecimal fallbackProcessingPercent(LoanEntity loan) {
        if (loan.getCategory() == LoanCategory.GROUP) {
            return GROUP_PROCESSING_PERCENT;
        }
        if (loan.getCategory() == LoanCategory.INDIVIDUAL) {
            return loan.getGroupId() != null ? GROUP_MEMBER_PROCESSING_PERCENT : INDIVIDUAL_PROCESSING_PERCENT;
        }
        return BigDecimal.ZERO;
    }

    private BigDecimal defaultFormFee(LoanEntity loan, EffectiveLoanConfig config) {
        if (loan.getCategory() == LoanCategory.GROUP || loan.getGroupId() != null) {
            return Money.round2(firstNonNull(config.getGroup().getFormFeeAmountLrd(), GROUP_FORM_FEE_LRD));
        }
        LoanTypeConfig individual = config.getIndividual();
        BigDecimal fee = loan.isReturningClient()
                ? firstNonNull(individual.getFormFeeAmountLrdReturning(), RETURNING_INDIVIDUAL_FORM_FEE_LRD)
                : firstNonNull(individual.getFormFeeAmountLrdNew(), NEW_INDIVIDUAL_FORM_FEE_LRD);
        return Money.round2(fee);
    }

    // --- schedule -----------------------------------------------------------

    public int weeksEquivalent(Integer number, DurationUnit unit) {
        int n = number == null ? 0 : number;
        return (unit == null ? DurationUnit.WEEKS : unit).toWeeks(n);
    }

    public int monthsEquivalent(Integer number, DurationUnit unit) {
        int n = number == null ? 0 : number;
        return (unit == null ? DurationUnit.WEEKS : unit).toMonths(n);
    }

    /**
     * Number of repayment periods implied by the duration alone. A missing plan is weekly.
     */
    public int formulaPeriodCount(PaymentPlan plan, Integer number, DurationUnit unit) {
        int weeks = weeksEquivalent(number, unit);
        if (plan == PaymentPlan.BI_WEEKLY) {
            return (weeks + 1) / 2;
        }
        if (plan == PaymentPlan.MONTHLY) {
            return monthsEquivalent(number, unit);
        }
        return weeks;
    }

    /**
     * Due dates from {@code start} to {@code end} inclusive, stepping by the plan's interval.
     */
    public List<LocalDate> dueDates(PaymentPlan plan, LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            return Collections.emptyList();
        }
        PaymentPlan effective = plan == null ? PaymentPlan.WEEKLY : plan;
        List<LocalDate> dates = new ArrayList<>();
        LocalDate cursor = start;
        int iterations = 0;
        while (!cursor.isAfter(end) && iterations < MAX_SCHEDULE_ITERATIONS) {
            dates.add(cursor);
            cursor = effective.step(cursor);
            iterations++;
        }
        return dates;
    }

    /**
     * Repayment schedule for the loan. Date-stepping from the collection start date to
     * the ending date is authoritative when both are known; otherwise the period count
     * comes from the duration formula.
     */
    public RepaymentSchedule schedule(LoanEntity loan) {
        PaymentPlan plan = loan.getPaymentPlan() == null ? PaymentPlan.WEEKLY : loan.getPaymentPlan();
        BigDecimal total = totalWithInterest(loan);

        LocalDate end = loan.getEndingDate();
        if (end == null && loan.getDisbursementDate() != null && loan.getLoanDurationNumber() != null) {
            end = addDuration(loan.getDisbursementDate(), loan.getLoanDurationNumber(), loan.getLoanDurationUnit());
        }
        List<LocalDate> dates = loan.getCollectionStartDate() != null
                ? dueDates(plan, loan.getCollectionStartDate(), end)
                : Collections.emptyList();
        int periods = dates.isEmpty()
                ? formulaPeriodCount(plan, loan.getLoanDurationNumber(), loan.getLoanDurationUnit())
                : dates.size();

        BigDecimal perPeriod = Money.divide(total, periods);
        BigDecimal finalPeriod = periods > 0
                ? Money.round2(total.subtract(perPeriod.multiply(BigDecimal.valueOf(periods - 1L))).max(BigDecimal.ZERO))
                : Money.ZERO;

        return RepaymentSchedule.builder()
                .plan(plan)
                .periodCount(periods)
                .totalWithInterest(total)
                .perPeriodAmount(perPeriod)
                .finalPeriodAmount(finalPeriod)
                .dueDates(dates)
                .build();
    }

    /**
     * Due dates for reporting. Falls back to stepping {@code periodCount} times from
     * one period after disbursement when no explicit start date is set.
     */
    public List<LocalDate> reportingDueDates(LoanEntity loan, RepaymentSchedule schedule) {
        if (!schedule.getDueDates().isEmpty()) {
            return schedule.getDueDates();
        }
        LocalDate start = loan.getCollectionStartDate();
        if (start == null && loan.getDisbursementDate() != null) {
            start = schedule.getPlan().step(loan.getDisbursementDate());
        }
        if (start == null) {
            return Collections.emptyList();
        }
        List<LocalDate> dates = new ArrayList<>();
        LocalDate cursor = start;
        for (int i = 0; i < Math.min(schedule.getPeriodCount(), MAX_SCHEDULE_ITERATIONS); i++) {
            dates.add(cursor);
            cursor = schedule.getPlan().step(cursor);
        }
        return dates;
    }

    public BigDecimal totalWithInterest(LoanEntity loan) {
        if (loan.getTotalAmountToBePaid() != null) {
            return Money.round2(loan.getTotalAmountToBePaid());
        }
        return Money.withInterest(loan.getLoanAmount(), loan.getInterestRate());
    }

    /**
     * Interest planned over the life of the loan.
     */
    public BigDecimal plannedInterest(LoanEntity loan) {
        BigDecimal principal = Money.orZero(loan.getLoanAmount());
        if (loan.getTotalAmountToBePaid() != null) {
            return Money.round2(loan.getTotalAmountToBePaid().subtract(principal));
        }
        return Money.percentOf(principal, loan.getInterestRate());
    }

    /**
     * Declared value of the collateral pledged for the loan.
     */
    public BigDecimal collateralValue(LoanEntity loan) {
        if (loan.getCollateralDetails() == null) {
            return Money.ZERO;
        }
        return Money.round2(loan.getCollateralDetails().getPropertyValue());
    }

    /**
     * Amount a disbursement adds to the balance waiting to be collected. Group loans
     * carry their interest share on every tranche.
     */
    public BigDecimal waitingAmountForDistribution(LoanEntity loan, BigDecimal amount) {
        if (loan != null && loan.getCategory() == LoanCategory.GROUP) {
            return Money.withInterest(amount, loan.getInterestRate());
        }
        return Money.round2(amount);
    }

    public LocalDate addDuration(LocalDate date, Integer number, DurationUnit unit) {
        if (date == null) {
            return null;
        }
        if (number == null || unit == null) {
            return date;
        }
        return unit.addTo(date, number);
    }

    public boolean isLocalCurrency(Currency currency) {
        return currency != null && currency.isLocal();
    }

    private static BigDecimal firstNonNull(BigDecimal value, BigDecimal fallback) {
        return value != null ? value : fallback;
    }
}
