package com.microfinance.domain.service;

import com.microfinance.api.dto.DistributionEntryRequest;
import com.microfinance.api.dto.DistributionRequest;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.Money;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.ForbiddenOperationException;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.DistributionRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Disbursement tranches paid out against active loans.
 *
 * Every change to a tranche queues signed metric events for the amount
 * difference: creation the full amount, update the delta, deletion the
 * negation. Group loans carry their interest share on the waiting balance
 * in all three cases.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributionLedgerService {

    private final DistributionRepository distributionRepository;
    private final LoanRepository loanRepository;
    private final LoanMetricEvents loanMetricEvents;
    private final MetricOutboxWriter metricOutboxWriter;
    private final LoanAccessPolicy accessPolicy;
    private final MeterRegistry meterRegistry;

    @Transactional
    @Retry(name = "loanLedger")
    public List<DistributionEntity> create(UUID loanId, DistributionRequest request, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(loanId).orElseThrow(() -> ResourceNotFoundException.loan(loanId));
        accessPolicy.requireAccess(user, loan);
        if (loan.getStatus() != LoanStatus.ACTIVE) {
            throw new LoanValidationException("Distributions require an active loan; loan " + loanId
                    + " is " + loan.getStatus().getWireName());
        }

        List<DistributionEntryRequest> tranches = request.tranches();
        Map<String, String> errors = new LinkedHashMap<>();
        List<DistributionEntity> distributions = new ArrayList<>(tranches.size());
        for (int i = 0; i < tranches.size(); i++) {
            DistributionEntryRequest tranche = tranches.get(i);
            String field = tranches.size() > 1 ? "entries[" + i + "]." : "";
            if (!Money.isPositive(tranche.getAmount())) {
                errors.put(field + "amount", "must be greater than 0");
                continue;
            }
            Currency currency = tranche.getCurrency() != null ? tranche.getCurrency() : loan.getCurrency();
            if (currency != loan.getCurrency()) {
                errors.put(field + "currency", "Distribution currency " + currency
                        + " does not match loan currency " + loan.getCurrency());
                continue;
            }
            distributions.add(DistributionEntity.builder()
                    .loanId(loan.getId())
                    .groupId(tranche.getGroupId() != null ? tranche.getGroupId() : loan.getGroupId())
                    .memberId(loan.hasSingleClient() ? loan.getClientId() : tranche.getMemberId())
                    .amount(Money.round2(tranche.getAmount()))
                    .currency(currency)
                    .distributionDate(tranche.getDistributionDate() != null ? tranche.getDistributionDate() : LocalDate.now())
                    .notes(tranche.getNotes())
                    .branchName(loan.getBranchName())
                    .branchCode(loan.getBranchCode())
                    .createdByEmail(user != null ? user.getEmail() : null)
                    .build());
        }
        if (!errors.isEmpty()) {
            throw new LoanValidationException(errors);
        }

        List<DistributionEntity> saved = distributionRepository.saveAll(distributions);

        if (adjustSchedule(loan, request, saved.get(0).getDistributionDate())) {
            loanRepository.save(loan);
        }

        List<MetricEventPayload> events = new ArrayList<>();
        for (DistributionEntity distribution : saved) {
            events.addAll(loanMetricEvents.distribution(loan, distribution, distribution.getAmount(), "create"));
        }
        metricOutboxWriter.enqueue(String.valueOf(loan.getId()), events);

        count("create", saved.size());
        log.info("Created {} distribution(s) on loan {}", saved.size(), loan.getId());
        return saved;
    }

    @Transactional
    public DistributionEntity update(UUID distributionId, DistributionEntryRequest request, UserIdentity user) {
        DistributionEntity distribution = distributionRepository.findById(distributionId)
                .orElseThrow(() -> new ResourceNotFoundException("Distribution not found: " + distributionId));
        LoanEntity loan = loanRepository.findById(distribution.getLoanId()).orElse(null);
        requireAccess(user, distribution, loan);

        BigDecimal previous = Money.orZero(distribution.getAmount());
        if (request.getAmount() != null) {
            if (!Money.isPositive(request.getAmount())) {
                throw new LoanValidationException("Distribution amount must be greater than 0");
            }
            distribution.setAmount(Money.round2(request.getAmount()));
        }
        if (request.getCurrency() != null) {
            Currency expected = loan != null ? loan.getCurrency() : distribution.getCurrency();
            if (request.getCurrency() != expected) {
                throw new LoanValidationException("Distribution currency " + request.getCurrency()
                        + " does not match loan currency " + expected);
            }
            distribution.setCurrency(request.getCurrency());
        }
        if (request.getMemberId() != null && (loan == null || !loan.hasSingleClient())) {
            distribution.setMemberId(request.getMemberId());
        }
        if (request.getGroupId() != null) {
            distribution.setGroupId(request.getGroupId());
        }
        if (request.getDistributionDate() != null) {
            distribution.setDistributionDate(request.getDistributionDate());
        }
        if (request.getNotes() != null) {
            distribution.setNotes(request.getNotes());
        }

        DistributionEntity saved = distributionRepository.save(distribution);

        BigDecimal delta = saved.getAmount().subtract(previous);
        if (delta.signum() != 0) {
            metricOutboxWriter.enqueue(String.valueOf(saved.getLoanId()),
                    loanMetricEvents.distribution(loan, saved, delta, "update"));
        }

        count("update", 1);
        log.info("Distribution {} updated: amount {} -> {}", saved.getId(), previous, saved.getAmount());
        return saved;
    }

    @Transactional
    public void delete(UUID distributionId, UserIdentity user) {
        DistributionEntity distribution = distributionRepository.findById(distributionId)
                .orElseThrow(() -> new ResourceNotFoundException("Distribution not found: " + distributionId));
        LoanEntity loan = loanRepository.findById(distribution.getLoanId()).orElse(null);
        requireAccess(user, distribution, loan);

        distributionRepository.delete(distribution);
        metricOutboxWriter.enqueue(String.valueOf(distribution.getLoanId()),
                loanMetricEvents.distribution(loan, distribution, Money.orZero(distribution.getAmount()).negate(), "delete"));

        count("delete", 1);
        log.info("Distribution {} deleted from loan {}", distributionId, distribution.getLoanId());
    }

    @Transactional(readOnly = true)
    public List<DistributionEntity> listByLoan(UUID loanId, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(loanId).orElseThrow(() -> ResourceNotFoundException.loan(loanId));
        accessPolicy.requireAccess(user, loan);
        return distributionRepository.findByLoanIdOrderByCreatedAtDesc(loanId);
    }

    /**
     * Branch-filtered listing. Restricted users see the tranches they recorded in their branch.
     */
    @Transactional(readOnly = true)
    public List<DistributionEntity> list(String branchName, String branchCode, UserIdentity user) {
        Specification<DistributionEntity> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (branchName != null && !branchName.isBlank()) {
                predicates.add(cb.equal(root.get("branchName"), branchName));
            }
            String code = branchCode;
            if ((code == null || code.isBlank()) && user != null && user.isRestricted()) {
                code = user.getBranchCode();
            }
            if (code != null && !code.isBlank()) {
                predicates.add(cb.equal(root.get("branchCode"), code));
            }
            if (user != null && user.isRestricted()) {
                predicates.add(cb.equal(cb.lower(root.<String>get("createdByEmail")),
                        String.valueOf(user.getEmail()).toLowerCase()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return distributionRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    /**
     * Push schedule changes carried by a distribution onto its loan.
     *
     * @return true when the loan changed
     */
    boolean adjustSchedule(LoanEntity loan, DistributionRequest request, LocalDate distributionDate) {
        boolean changed = false;
        if (request.getCollectionStartDate() != null) {
            loan.setCollectionStartDate(request.getCollectionStartDate());
            changed = true;
        } else if (request.getCollectionStartRule() != null) {
            LocalDate anchor = request.getCollectionStartAnchor() != null
                    ? request.getCollectionStartAnchor()
                    : distributionDate;
            loan.setCollectionStartDate(request.getCollectionStartRule().apply(anchor));
            changed = true;
        }
        if (request.getLoanDurationNumber() != null || request.getLoanDurationUnit() != null) {
            if (request.getLoanDurationNumber() != null) {
                loan.setLoanDurationNumber(request.getLoanDurationNumber());
            }
            if (request.getLoanDurationUnit() != null) {
                loan.setLoanDurationUnit(request.getLoanDurationUnit());
            }
            // recomputed from disbursement date and duration on every schedule read
            loan.setEndingDate(null);
            changed = true;
        }
        if (changed) {
            log.info("Loan {} schedule adjusted: collection start {}, duration {} {}", loan.getId(),
                    loan.getCollectionStartDate(), loan.getLoanDurationNumber(),
                    loan.getLoanDurationUnit() == null ? null : loan.getLoanDurationUnit().getWireName());
        }
        return changed;
    }

    private void requireAccess(UserIdentity user, DistributionEntity distribution, LoanEntity loan) {
        if (loan != null) {
            accessPolicy.requireAccess(user, loan);
            return;
        }
        if (user != null && user.isRestricted() && (distribution.getCreatedByEmail() == null
                || !distribution.getCreatedByEmail().equalsIgnoreCase(user.getEmail()))) {
            throw new ForbiddenOperationException("Forbidden");
        }
    }

    private void count(String operation, int amount) {
        Counter.builder("loan.distributions")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment(amount);
    }
}
