package com.microfinance.domain.service;

import com.microfinance.api.dto.LoanFilter;
import com.microfinance.api.dto.LoanRequest;
import com.microfinance.domain.model.EffectiveLoanConfig;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.GroupEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.OutboxEventEntity;
import com.microfinance.infrastructure.persistence.repository.DistributionRepository;
import com.microfinance.infrastructure.persistence.repository.GroupRepository;
import com.microfinance.infrastructure.persistence.repository.LoanAgreementRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import com.microfinance.infrastructure.persistence.repository.OutboxEventRepository;
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
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Loan creation, update, reads and administrative delete.
 *
 * Every save runs the category rules and re-derives the fee fields against
 * the branch configuration. Creation queues the fee metric events in the
 * same transaction as the loan insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanService {

    private final LoanRepository loanRepository;
    private final GroupRepository groupRepository;
    private final DistributionRepository distributionRepository;
    private final LoanAgreementRepository loanAgreementRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final LoanMapper loanMapper;
    private final LoanValidator loanValidator;
    private final LoanConfigResolver loanConfigResolver;
    private final FeeScheduleCalculator calculator;
    private final LoanMetricEvents loanMetricEvents;
    private final MetricOutboxWriter metricOutboxWriter;
    private final MetricEventService metricEventService;
    private final GroupLoanTotalService groupLoanTotalService;
    private final LoanAccessPolicy accessPolicy;
    private final AfterCommitTasks afterCommitTasks;
    private final MeterRegistry meterRegistry;

    @Transactional
    public LoanEntity create(LoanRequest request, UserIdentity user) {
        LoanEntity loan = loanMapper.toEntity(request);
        loan.setStatus(LoanStatus.PENDING);
        loan.setTotalRealization(BigDecimal.ZERO);

        if (user != null && user.getEmail() != null) {
            loan.setCreatedByEmail(user.getEmail());
        }
        if (user != null && user.isRestricted()) {
            loan.setBranchName(user.getBranchName());
            loan.setBranchCode(user.getBranchCode());
            loan.setLoanOfficerName(user.getUsername());
        }

        prepare(loan);
        LoanEntity saved = loanRepository.save(loan);

        metricOutboxWriter.enqueue(aggregateId(saved), loanMetricEvents.creation(saved));
        if (saved.countsTowardGroupTotal()) {
            scheduleGroupTotal(saved.getGroupId());
        }

        Counter.builder("loan.created")
                .tag("category", saved.getCategory().getWireName())
                .register(meterRegistry)
                .increment();

        log.info("Loan created: {} ({} {} {}, branch {})", saved.getId(), saved.getCategory().getWireName(),
                saved.getLoanAmount(), saved.getCurrency(), saved.getBranchCode());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<LoanEntity> list(LoanFilter filter, UserIdentity user) {
        LoanFilter effective = filter == null ? new LoanFilter() : filter;
        Specification<LoanEntity> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (notBlank(effective.getBranchName())) {
                predicates.add(cb.equal(root.get("branchName"), effective.getBranchName()));
            }
            String branchCode = effective.getBranchCode();
            if (!notBlank(branchCode) && user != null && user.isRestricted()) {
                branchCode = user.getBranchCode();
            }
            if (notBlank(branchCode)) {
                predicates.add(cb.equal(root.get("branchCode"), branchCode));
            }
            if (effective.getCategory() != null) {
                predicates.add(cb.equal(root.get("category"), effective.getCategory()));
            }
            if (effective.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), effective.getStatus()));
            }
            if (effective.getGroupId() != null) {
                predicates.add(cb.equal(root.get("groupId"), effective.getGroupId()));
            }
            if (user != null && user.isRestricted()) {
                predicates.add(cb.or(
                        cb.equal(cb.lower(root.<String>get("createdByEmail")), lower(user.getEmail())),
                        cb.equal(root.get("loanOfficerName"), String.valueOf(user.getUsername()))));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        List<LoanEntity> loans = loanRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt"));
        log.debug("Listed {} loans for filter {}", loans.size(), effective);
        return loans;
    }

    @Transactional(readOnly = true)
    public LoanEntity get(UUID id, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.loan(id));
        accessPolicy.requireAccess(user, loan);
        return loan;
    }

    @Transactional(readOnly = true)
    public List<LoanEntity> listByGroup(UUID groupId, LoanCategory category, LoanStatus status, UserIdentity user) {
        GroupEntity group = groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group not found: " + groupId));
        accessPolicy.requireAccess(user, group);
        return loanRepository.findByGroupIdOrderByCreatedAtDesc(groupId).stream()
                .filter(loan -> category == null || loan.getCategory() == category)
                .filter(loan -> status == null || loan.getStatus() == status)
                .collect(Collectors.toList());
    }

    /**
     * Officer edit of a pending loan. Fee metrics from the previous terms are
     * reversed and the new ones queued.
     */
    @Transactional
    public LoanEntity update(UUID id, LoanRequest request, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.loan(id));
        accessPolicy.requireAccess(user, loan);
        if (loan.getStatus() != LoanStatus.PENDING) {
            throw new LoanValidationException("Only pending loans can be updated; loan " + id + " is " + loan.getStatus().getWireName());
        }

        List<MetricEventPayload> previousFees = loanMetricEvents.creation(loan);
        UUID previousGroup = loan.countsTowardGroupTotal() ? loan.getGroupId() : null;

        boolean termsChanged = changed(request.getLoanAmount(), loan.getLoanAmount())
                || changed(request.getInterestRate(), loan.getInterestRate());
        boolean durationChanged = request.getLoanDurationNumber() != null
                || request.getLoanDurationUnit() != null
                || request.getDisbursementDate() != null;

        loanMapper.applyUpdate(loan, request);

        if (termsChanged && request.getTotalAmountToBePaid() == null) {
            loan.setTotalAmountToBePaid(null);
        }
        if (termsChanged && request.getCashAmountCredited() == null) {
            loan.setCashAmountCredited(null);
        }
        if (durationChanged && request.getEndingDate() == null) {
            loan.setEndingDate(null);
        }
        if (user != null && user.isRestricted()) {
            loan.setBranchName(user.getBranchName());
            loan.setBranchCode(user.getBranchCode());
            loan.setLoanOfficerName(user.getUsername());
            loan.setCreatedByEmail(user.getEmail());
        } else if (loan.getCreatedByEmail() == null && user != null) {
            loan.setCreatedByEmail(user.getEmail());
        }

        prepare(loan);
        LoanEntity saved = loanRepository.save(loan);

        List<MetricEventPayload> adjustment = new ArrayList<>(loanMetricEvents.reversal(previousFees));
        adjustment.addAll(loanMetricEvents.creation(saved));
        metricOutboxWriter.enqueue(aggregateId(saved), adjustment);

        Set<UUID> groups = new LinkedHashSet<>();
        if (previousGroup != null) {
            groups.add(previousGroup);
        }
        if (saved.countsTowardGroupTotal()) {
            groups.add(saved.getGroupId());
        }
        groups.forEach(this::scheduleGroupTotal);

        log.info("Loan updated: {}", saved.getId());
        return saved;
    }

    /**
     * Administrative delete. Removes the loan's distributions, agreement and
     * metric events along with it.
     */
    @Transactional
    public void delete(UUID id, UserIdentity user) {
        LoanEntity loan = loanRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.loan(id));
        accessPolicy.requireAccess(user, loan);

        long distributions = distributionRepository.deleteByLoanId(id);
        loanAgreementRepository.deleteByLoanId(id);
        outboxEventRepository.supersedeForAggregate(aggregateId(loan),
                EnumSet.of(OutboxEventEntity.EventStatus.PENDING, OutboxEventEntity.EventStatus.FAILED),
                OutboxEventEntity.EventStatus.SUPERSEDED);
        int events = metricEventService.purgeForLoan(id);
        loanRepository.delete(loan);

        if (loan.countsTowardGroupTotal()) {
            scheduleGroupTotal(loan.getGroupId());
        }
        log.info("Loan deleted: {} ({} distributions, {} metric events removed)", id, distributions, events);
    }

    /**
     * Category rules, then fee derivation against the branch configuration.
     */
    void prepare(LoanEntity loan) {
        loanValidator.normalizeForCategory(loan);
        loanValidator.validate(loan);
        EffectiveLoanConfig config = loanConfigResolver.resolve(loan.getBranchCode());
        calculator.deriveFields(loan, config);
    }

    void scheduleGroupTotal(UUID groupId) {
        afterCommitTasks.run("group loan total " + groupId, () -> groupLoanTotalService.recalculate(groupId));
    }

    static String aggregateId(LoanEntity loan) {
        return String.valueOf(loan.getId());
    }

    private static boolean changed(BigDecimal requested, BigDecimal current) {
        if (requested == null) {
            return false;
        }
        return current == null || requested.compareTo(current) != 0;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String lower(String value) {
        return Objects.toString(value, "").toLowerCase();
    }
}
