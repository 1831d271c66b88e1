package com.microfinance.domain.service;

import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.RepaymentSchedule;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.InvalidStatusTransitionException;
import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.LoanAgreementEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Loan status machine: pending -> active -> paid | defaulted.
 *
 * Activation Flow:
 * 1. Approver check (admin or branch head)
 * 2. Disbursement date defaults to today, ending date derived if absent
 * 3. Installment committed from the repayment schedule
 * 4. Interest (and for non-group loans disbursement) metric events queued
 * 5. After commit: agreement generated, collateral cash deposited
 *
 * Steps 1-4 commit atomically. Step 5 is best-effort and idempotent; a failure
 * is logged and never reverts the activation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanLifecycleService {

    private final LoanRepository loanRepository;
    private final FeeScheduleCalculator calculator;
    private final LoanMetricEvents loanMetricEvents;
    private final MetricOutboxWriter metricOutboxWriter;
    private final LoanAgreementService loanAgreementService;
    private final CollateralDepositService collateralDepositService;
    private final GroupLoanTotalService groupLoanTotalService;
    private final LoanAccessPolicy accessPolicy;
    private final AfterCommitTasks afterCommitTasks;
    private final MeterRegistry meterRegistry;

    @Transactional
    @Retry(name = "loanLedger")
    public LoanEntity changeStatus(UUID loanId, LoanStatus target, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(loanId).orElseThrow(() -> ResourceNotFoundException.loan(loanId));
        accessPolicy.requireAccess(user, loan);

        LoanStatus current = loan.getStatus();
        if (current == target) {
            log.debug("Loan {} already {}", loanId, target.getWireName());
            return loan;
        }
        if (!current.canTransitionTo(target)) {
            log.warn("Rejected status change of loan {} from {} to {}", loanId, current.getWireName(), target.getWireName());
            throw new InvalidStatusTransitionException(current, target);
        }
        if (target == LoanStatus.ACTIVE) {
            accessPolicy.requireApprover(user, "approve loans");
            activate(loan);
        }

        loan.setStatus(target);
        LoanEntity saved = loanRepository.save(loan);

        if (target == LoanStatus.ACTIVE) {
            metricOutboxWriter.enqueue(String.valueOf(saved.getId()), loanMetricEvents.activation(saved));
            afterCommitTasks.run("loan agreement " + saved.getId(), () -> generateAgreement(saved));
            afterCommitTasks.run("collateral deposit " + saved.getId(), () -> collateralDepositService.depositCollateral(saved));
        }
        if (saved.countsTowardGroupTotal()) {
            UUID groupId = saved.getGroupId();
            afterCommitTasks.run("group loan total " + groupId, () -> groupLoanTotalService.recalculate(groupId));
        }

        Counter.builder("loan.status.changed")
                .tag("to", target.getWireName())
                .register(meterRegistry)
                .increment();

        log.info("Loan {} status changed: {} -> {}", saved.getId(), current.getWireName(), target.getWireName());
        return saved;
    }

    /**
     * Create the agreement on demand. Returns the existing one when present.
     */
    @Transactional(readOnly = true)
    public LoanAgreementEntity initAgreement(UUID loanId, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(loanId).orElseThrow(() -> ResourceNotFoundException.loan(loanId));
        accessPolicy.requireAccess(user, loan);
        try {
            return loanAgreementService.ensureAgreement(loan);
        } catch (DataIntegrityViolationException e) {
            log.info("Loan agreement for {} created concurrently, returning the stored one", loanId);
            return loanAgreementService.getByLoanId(loanId);
        }
    }

    @Transactional(readOnly = true)
    public LoanAgreementEntity getAgreement(UUID loanId, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(loanId).orElseThrow(() -> ResourceNotFoundException.loan(loanId));
        accessPolicy.requireAccess(user, loan);
        return loanAgreementService.getByLoanId(loanId);
    }

    private void activate(LoanEntity loan) {
        if (loan.getDisbursementDate() == null) {
            loan.setDisbursementDate(LocalDate.now());
        }
        if (loan.getEndingDate() == null && loan.getLoanDurationNumber() != null && loan.getLoanDurationUnit() != null) {
            loan.setEndingDate(calculator.addDuration(
                    loan.getDisbursementDate(), loan.getLoanDurationNumber(), loan.getLoanDurationUnit()));
        }
        RepaymentSchedule schedule = calculator.schedule(loan);
        if (schedule.getPeriodCount() > 0) {
            loan.setWeeklyInstallment(schedule.getPerPeriodAmount());
        }
        log.info("Loan {} activated: {} periods of {} ({})", loan.getId(), schedule.getPeriodCount(),
                schedule.getPerPeriodAmount(), schedule.getPlan().getWireName());
    }

    private void generateAgreement(LoanEntity loan) {
        try {
            loanAgreementService.ensureAgreement(loan);
        } catch (DataIntegrityViolationException e) {
            log.info("Loan agreement for {} already exists", loan.getId());
        }
    }
}
