package com.microfinance.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.infrastructure.persistence.entity.OutboxEventEntity;
import com.microfinance.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;

/**
 * Queues metric events in the outbox, inside the caller's transaction, so they
 * commit or roll back together with the ledger mutation that produced them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricOutboxWriter {

    public static final String EVENT_TYPE = "METRIC_EVENTS";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public void enqueue(String aggregateId, List<MetricEventPayload> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        try {
            OutboxEventEntity outboxEvent = OutboxEventEntity.builder()
                    .eventType(EVENT_TYPE)
                    .aggregateId(aggregateId)
                    .payload(objectMapper.writeValueAsString(events))
                    .build();
            outboxEventRepository.save(outboxEvent);
            log.debug("Queued {} metric events for {}", events.size(), aggregateId);
        } catch (JsonProcessingException e) {
            // metrics are rebuilt by recalculation; never fail the ledger write over them
            log.error("Failed to queue metric events for {}: {}", aggregateId, e.getMessage(), e);
        }
    }

    /**
     * Retire every metric record the relay has not applied yet. Recalculation
     * rebuilds their effect, so applying them afterwards would double count.
     *
     * @return number of records superseded
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int supersedePending() {
        int superseded = outboxEventRepository.supersede(EVENT_TYPE,
                EnumSet.of(OutboxEventEntity.EventStatus.PENDING, OutboxEventEntity.EventStatus.FAILED),
                OutboxEventEntity.EventStatus.SUPERSEDED);
        if (superseded > 0) {
            log.info("Superseded {} pending metric outbox records", superseded);
        }
        return superseded;
    }
}
