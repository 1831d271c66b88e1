package com.microfinance.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microfinance.domain.model.MetricEventPayload;
import com.microfinance.infrastructure.persistence.entity.OutboxEventEntity;
import com.microfinance.infrastructure.persistence.repository.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;

/**
 * Relay for queued metric events (transactional outbox pattern).
 *
 * How It Works:
 * 1. Ledger mutations write metric intents to the outbox in their own transaction
 * 2. This relay polls pending and failed records
 * 3. Each record is applied to the metric event store once, keyed by its id
 * 4. The applied events are published to the metric events topic for reporting
 *
 * Failure Handling:
 * - Store insert fails: record marked FAILED, retried until max-retries
 * - Record already applied (crash after insert): only marked published
 * - Kafka publish fails: logged, the store stays authoritative
 * - Recalculation supersedes unapplied records, they are never picked up again
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxPublisher {

    private static final TypeReference<List<MetricEventPayload>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final OutboxEventRepository outboxEventRepository;
    private final MetricEventService metricEventService;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.metric-events}")
    private String metricEventsTopic;

    @Value("${app.outbox.batch-size:50}")
    private int batchSize;

    @Value("${app.outbox.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:500}")
    @Transactional
    public void publishPendingEvents() {
        try {
            List<OutboxEventEntity> pendingEvents = outboxEventRepository
                    .findByStatusInAndRetryCountLessThanOrderByCreatedAtAsc(
                            EnumSet.of(OutboxEventEntity.EventStatus.PENDING, OutboxEventEntity.EventStatus.FAILED),
                            maxRetries,
                            PageRequest.of(0, batchSize));

            if (pendingEvents.isEmpty()) {
                return;
            }

            log.debug("Relaying {} outbox records", pendingEvents.size());

            for (OutboxEventEntity event : pendingEvents) {
                relay(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox relay: {}", e.getMessage(), e);
        }
    }

    void relay(OutboxEventEntity event) {
        if (!MetricOutboxWriter.EVENT_TYPE.equals(event.getEventType())) {
            log.warn("Skipping outbox record {} of unknown type {}", event.getEventId(), event.getEventType());
            event.markFailed("Unknown event type: " + event.getEventType());
            outboxEventRepository.save(event);
            return;
        }
        try {
            List<MetricEventPayload> metricEvents = objectMapper.readValue(event.getPayload(), PAYLOAD_TYPE);

            if (metricEventService.isApplied(event.getEventId())) {
                log.debug("Outbox record {} already applied", event.getEventId());
            } else {
                metricEventService.recordRelayed(metricEvents, event.getEventId());
            }

            event.markPublished();
            outboxEventRepository.save(event);
            increment("applied");

            publish(event, metricEvents);

        } catch (Exception e) {
            log.error("Failed to apply outbox record {}: {}", event.getEventId(), e.getMessage(), e);
            event.markFailed(e.getMessage());
            outboxEventRepository.save(event);
            increment("failed");
        }
    }

    private void publish(OutboxEventEntity event, List<MetricEventPayload> metricEvents) {
        for (MetricEventPayload metricEvent : metricEvents) {
            kafkaTemplate.send(metricEventsTopic, event.getAggregateId(), metricEvent)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish metric event from outbox record {}: {}",
                                    event.getEventId(), ex.getMessage());
                            increment("publish_failed");
                        }
                    });
        }
    }

    private void increment(String result) {
        Counter.builder("metrics.outbox.relayed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
