package com.microfinance.domain.service;

import com.microfinance.api.dto.CollectionRequest;
import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.Money;
import com.microfinance.domain.model.RepaymentSchedule;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.ClientEntity;
import com.microfinance.infrastructure.persistence.entity.CollectionEntry;
import com.microfinance.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.ClientRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only repayment ledger embedded in the loan.
 *
 * Processing Flow:
 * 1. Check idempotency key (duplicate submissions are acknowledged, not re-applied)
 * 2. Resolve defaults against the repayment schedule and check currencies
 * 3. Append entries and advance the realized total in one save
 * 4. Queue one metric event triple per entry in the same transaction
 *
 * The loan row is version-checked; a concurrent append fails the save with an
 * optimistic-lock conflict and the whole operation is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionLedgerService {

    public static final String SOURCE_API = "api";
    public static final String SOURCE_KAFKA = "kafka";

    private final LoanRepository loanRepository;
    private final ClientRepository clientRepository;
    private final FeeScheduleCalculator calculator;
    private final LoanMetricEvents loanMetricEvents;
    private final MetricOutboxWriter metricOutboxWriter;
    private final IdempotencyService idempotencyService;
    private final LoanAccessPolicy accessPolicy;
    private final MeterRegistry meterRegistry;

    @Transactional
    @Retry(name = "loanLedger")
    public LoanEntity addCollection(UUID loanId, CollectionRequest request, String idempotencyKey,
                                    UserIdentity user, String source) {
        return append(loanId, Collections.singletonList(request), idempotencyKey, user, source);
    }

    /**
     * All entries are validated before any is appended; one save covers the batch.
     */
    @Transactional
    @Retry(name = "loanLedger")
    public LoanEntity addCollectionsBatch(UUID loanId, List<CollectionRequest> requests, String idempotencyKey,
                                          UserIdentity user) {
        if (requests == null || requests.isEmpty()) {
            throw new LoanValidationException("entries array is required");
        }
        return append(loanId, requests, idempotencyKey, user, SOURCE_API);
    }

    private LoanEntity append(UUID loanId, List<CollectionRequest> requests, String idempotencyKey,
                              UserIdentity user, String source) {
        LoanEntity loan = loanRepository.findById(loanId).orElseThrow(() -> ResourceNotFoundException.loan(loanId));
        accessPolicy.requireAccess(user, loan);

        Optional<IdempotencyRecordEntity> duplicate = idempotencyService.checkDuplicate(idempotencyKey);
        if (duplicate.isPresent()) {
            if (!loanId.equals(duplicate.get().getLoanId())) {
                log.warn("Idempotency key {} was used for loan {}, rejected for loan {}",
                        idempotencyKey, duplicate.get().getLoanId(), loanId);
                throw new LoanValidationException("Idempotency key " + idempotencyKey + " was already used for another loan");
            }
            count(source, "duplicate", 0);
            return loan;
        }

        RepaymentSchedule schedule = calculator.schedule(loan);
        String defaultMemberName = defaultMemberName(loan);
        int firstIndex = loan.getCollections().size();

        List<CollectionEntry> entries = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            entries.add(toEntry(loan, schedule, requests.get(i), firstIndex + i, defaultMemberName));
        }

        loan.appendCollections(entries);
        LoanEntity saved = loanRepository.save(loan);

        List<MetricEventPayload> events = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            events.addAll(loanMetricEvents.collection(saved, entries.get(i), firstIndex + i));
        }
        metricOutboxWriter.enqueue(String.valueOf(saved.getId()), events);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("loanId", saved.getId());
        response.put("entries", entries.size());
        response.put("totalRealization", saved.getTotalRealization());
        idempotencyService.storeIdempotencyRecord(idempotencyKey, saved.getId(), response);

        count(source, "success", entries.size());
        log.info("Appended {} collection(s) to loan {} via {}; total realized {}",
                entries.size(), saved.getId(), source, saved.getTotalRealization());
        return saved;
    }

    CollectionEntry toEntry(LoanEntity loan, RepaymentSchedule schedule, CollectionRequest request,
                            int periodIndex, String defaultMemberName) {
        Currency currency = request.getCurrency() != null ? request.getCurrency() : loan.getCurrency();
        if (currency != loan.getCurrency()) {
            throw new LoanValidationException("Collection currency " + currency
                    + " does not match loan currency " + loan.getCurrency());
        }

        BigDecimal scheduled = request.getScheduledAmount() != null
                ? Money.round2(request.getScheduledAmount())
                : Money.isPositive(loan.getWeeklyInstallment())
                        ? Money.round2(loan.getWeeklyInstallment())
                        : schedule.amountForPeriod(periodIndex);
        BigDecimal collected = Money.round2(request.getCollectedAmount());
        BigDecimal advance = Money.round2(request.getAdvancePayment());
        if (collected.signum() < 0 || advance.signum() < 0 || scheduled.signum() < 0) {
            throw new LoanValidationException("Collection amounts must not be negative");
        }
        BigDecimal fieldBalance = request.getFieldBalance() != null
                ? Money.round2(request.getFieldBalance())
                : Money.round2(scheduled.subtract(collected).subtract(advance).max(BigDecimal.ZERO));

        String memberName = request.getMemberName() != null && !request.getMemberName().isBlank()
                ? request.getMemberName()
                : defaultMemberName;

        return CollectionEntry.builder()
                .memberName(memberName)
                .scheduledAmount(scheduled)
                .collectedAmount(collected)
                .advancePayment(advance)
                .fieldBalance(fieldBalance)
                .currency(currency)
                .collectionDate(request.getCollectionDate() != null ? request.getCollectionDate() : LocalDate.now())
                .build();
    }

    private String defaultMemberName(LoanEntity loan) {
        if (loan.getClientId() == null) {
            return "";
        }
        return clientRepository.findById(loan.getClientId())
                .map(ClientEntity::getMemberName)
                .orElse("");
    }

    private void count(String source, String result, int entries) {
        Counter.builder("loan.collections.appended")
                .tag("source", source)
                .tag("result", result)
                .register(meterRegistry)
                .increment(Math.max(entries, 1));
    }
}
