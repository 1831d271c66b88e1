package com.microfinance.domain.service;

import com.microfinance.api.dto.MetricEventRequest;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.MetricName;
import com.microfinance.domain.model.MetricTotal;
import com.microfinance.domain.model.Money;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.MetricEventEntity;
import com.microfinance.infrastructure.persistence.repository.MetricEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only store of signed financial metric events.
 *
 * The balance of a metric for a set of dimensions is the sum of its events.
 * Reversals are negative events; rows are only ever deleted by recalculation
 * and by an administrative loan delete.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricEventService {

    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final MetricEventRepository metricEventRepository;

    /**
     * Insert a batch in its own transaction. Callers treat failure as non-fatal.
     *
     * @return number of events stored
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int recordMany(List<MetricEventPayload> events) {
        return persist(events, null);
    }

    /**
     * Insert the events of one outbox record, tagged with its id so it is applied once.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int recordRelayed(List<MetricEventPayload> events, UUID outboxEventId) {
        return persist(events, outboxEventId);
    }

    /**
     * Record manually entered events such as expenses. Loan-derived metrics are
     * rejected because recalculation would silently discard them.
     */
    @Transactional
    public int recordManual(List<MetricEventRequest> requests, UserIdentity user) {
        Map<String, String> errors = new LinkedHashMap<>();
        List<MetricEventPayload> events = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            MetricEventRequest request = requests.get(i);
            if (request.getMetric() == null) {
                errors.put("entries[" + i + "].metric", "is required");
                continue;
            }
            if (request.getMetric().isLoanDerived()) {
                errors.put("entries[" + i + "].metric", request.getMetric().getWireName() + " is derived from loans and cannot be entered manually");
                continue;
            }
            if (request.getValue() == null) {
                errors.put("entries[" + i + "].value", "is required");
                continue;
            }
            Map<String, Object> extra = request.getExtra() == null
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(request.getExtra());
            if (user != null && user.getEmail() != null) {
                extra.put("recordedBy", user.getEmail());
            }
            events.add(MetricEventPayload.builder()
                    .metric(request.getMetric())
                    .value(Money.round2(request.getValue()))
                    .eventDate(request.getDate() != null ? request.getDate() : LocalDate.now())
                    .branchName(firstNonBlank(request.getBranchName(), user == null ? null : user.getBranchName()))
                    .branchCode(firstNonBlank(request.getBranchCode(), user == null ? null : user.getBranchCode()))
                    .loanOfficerName(request.getLoanOfficerName())
                    .currency(request.getCurrency() != null ? request.getCurrency() : Currency.LRD)
                    .extra(extra)
                    .build());
        }
        if (!errors.isEmpty()) {
            throw new LoanValidationException(errors);
        }
        int stored = persist(events, null);
        log.info("Recorded {} manual metric events", stored);
        return stored;
    }

    /**
     * Delete every loan-derived event. Manual metrics survive.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int purgeLoanDerived() {
        return metricEventRepository.deleteByMetricIn(MetricName.loanDerivedMetrics());
    }

    @Transactional
    public int purgeForLoan(UUID loanId) {
        return metricEventRepository.deleteByLoanId(loanId);
    }

    @Transactional(readOnly = true)
    public boolean isApplied(UUID outboxEventId) {
        return metricEventRepository.existsByOutboxEventId(outboxEventId);
    }

    @Transactional(readOnly = true)
    public List<MetricTotal> summarize(Collection<MetricName> metrics, LocalDate dateFrom, LocalDate dateTo,
                                       String branchCode, String loanOfficerName, Currency currency) {
        Collection<MetricName> selected = metrics == null || metrics.isEmpty()
                ? EnumSet.allOf(MetricName.class)
                : metrics;
        return metricEventRepository.summarize(
                selected,
                dateFrom != null ? dateFrom : EARLIEST,
                dateTo != null ? dateTo : LATEST,
                blankToNull(branchCode),
                blankToNull(loanOfficerName),
                currency);
    }

    private int persist(List<MetricEventPayload> events, UUID outboxEventId) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        List<MetricEventEntity> entities = new ArrayList<>(events.size());
        for (MetricEventPayload event : events) {
            if (event.isZero() || event.getMetric() == null) {
                continue;
            }
            entities.add(MetricEventEntity.builder()
                    .metric(event.getMetric())
                    .value(Money.round2(event.getValue()))
                    .eventDate(event.getEventDate() != null ? event.getEventDate() : LocalDate.now())
                    .branchName(event.getBranchName())
                    .branchCode(event.getBranchCode())
                    .loanOfficerName(event.getLoanOfficerName())
                    .currency(event.getCurrency())
                    .loanId(event.getLoanId())
                    .groupId(event.getGroupId())
                    .clientId(event.getClientId())
                    .distributionId(event.getDistributionId())
                    .outboxEventId(outboxEventId)
                    .extra(event.getExtra() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(event.getExtra()))
                    .build());
        }
        if (entities.isEmpty()) {
            return 0;
        }
        metricEventRepository.saveAll(entities);
        return entities.size();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
