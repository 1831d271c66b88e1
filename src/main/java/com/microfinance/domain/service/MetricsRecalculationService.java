package com.microfinance.domain.service;

import com.microfinance.api.dto.RecalculationResult;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.domain.model.Money;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.DistributionRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rebuilds every loan-derived metric from current loan and distribution state.
 *
 * Unapplied outbox records are superseded first, then loan-derived events are
 * purged and replayed in batches. Manual metrics are left alone. Running it
 * twice over unchanged data yields the same store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsRecalculationService {

    private final LoanRepository loanRepository;
    private final DistributionRepository distributionRepository;
    private final LoanMetricEvents loanMetricEvents;
    private final MetricEventService metricEventService;
    private final MetricOutboxWriter metricOutboxWriter;
    private final LoanAccessPolicy accessPolicy;
    private final MeterRegistry meterRegistry;

    @Value("${app.metrics.recalculation.batch-size:50}")
    private int batchSize;

    @Transactional(readOnly = true)
    public RecalculationResult recalculate(UserIdentity user) {
        accessPolicy.requireApprover(user, "recalculate metrics");

        Timer.Sample sample = Timer.start(meterRegistry);
        int superseded = metricOutboxWriter.supersedePending();
        int purged = metricEventService.purgeLoanDerived();
        log.info("Metrics recalculation started: purged {} loan-derived events", purged);

        Batcher batcher = new Batcher();

        List<LoanEntity> loans = loanRepository.findAllByOrderByCreatedAtAsc();
        Map<UUID, LoanEntity> loansById = new HashMap<>();
        for (LoanEntity loan : loans) {
            loansById.put(loan.getId(), loan);
            batcher.addAll(replayLoan(loan));
        }

        int distributionCount = 0;
        for (DistributionEntity distribution : distributionRepository.findAllByOrderByDistributionDateAscCreatedAtAsc()) {
            if (!Money.isPositive(distribution.getAmount())) {
                continue;
            }
            LoanEntity loan = loansById.get(distribution.getLoanId());
            batcher.addAll(loanMetricEvents.distribution(loan, distribution, distribution.getAmount(), "create"));
            distributionCount++;
        }
        batcher.flush();

        boolean success = batcher.failedBatches == 0;
        sample.stop(Timer.builder("metrics.recalculation.duration")
                .register(meterRegistry));
        Counter.builder("metrics.recalculation.runs")
                .tag("result", success ? "success" : "partial")
                .register(meterRegistry)
                .increment();

        log.info("Metrics recalculation finished: {} loans, {} distributions, {} events stored, {} failed batches",
                loans.size(), distributionCount, batcher.stored, batcher.failedBatches);

        return RecalculationResult.builder()
                .success(success)
                .loans(loans.size())
                .distributions(distributionCount)
                .events(batcher.stored)
                .supersededOutboxRecords(superseded)
                .failedBatches(batcher.failedBatches)
                .build();
    }

    List<MetricEventPayload> replayLoan(LoanEntity loan) {
        List<MetricEventPayload> events = new ArrayList<>(loanMetricEvents.creation(loan));
        if (loan.getStatus() != null && loan.getStatus().hasBeenActivated()) {
            events.addAll(loanMetricEvents.activation(loan));
            // deposited on activation only
            if (Money.isPositive(loan.getCollateralCashAmount()) && loan.getClientId() != null) {
                events.addAll(loanMetricEvents.collateralDeposit(loan, loan.getCollateralCashAmount()));
            }
        }
        events.addAll(loanMetricEvents.collections(loan));
        return events;
    }

    private final class Batcher {
        private final List<MetricEventPayload> pending = new ArrayList<>();
        private int stored;
        private int failedBatches;

        void addAll(List<MetricEventPayload> events) {
            for (MetricEventPayload event : events) {
                Map<String, Object> extra = new LinkedHashMap<>(event.getExtra());
                extra.put("recalc", true);
                pending.add(event.toBuilder().extra(extra).build());
                if (pending.size() >= Math.max(batchSize, 1)) {
                    flush();
                }
            }
        }

        void flush() {
            if (pending.isEmpty()) {
                return;
            }
            List<MetricEventPayload> batch = new ArrayList<>(pending);
            pending.clear();
            try {
                stored += metricEventService.recordMany(batch);
            } catch (RuntimeException e) {
                failedBatches++;
                log.error("Failed to store recalculated metric batch of {} events: {}", batch.size(), e.getMessage(), e);
            }
        }
    }
}
