package com.microfinance.infrastructure.messaging;

import com.microfinance.api.dto.CollectionRequest;
import com.microfinance.domain.model.CollectionEvent;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.domain.service.CollectionLedgerService;
import com.microfinance.domain.service.IdempotencyService;
import com.microfinance.domain.service.IdentityResolver;
import com.microfinance.exception.LoanServiceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes field collections submitted by mobile agents.
 *
 * Offsets are committed manually after the collection is appended. Events are
 * idempotent on their key, so a redelivered event after a crash is absorbed by
 * the duplicate check. Events that fail validation or processing go to the DLQ.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollectionEventConsumer {

    private final CollectionLedgerService collectionLedgerService;
    private final IdempotencyService idempotencyService;
    private final IdentityResolver identityResolver;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.dlq}")
    private String dlqTopic;

    @KafkaListener(
            topics = "${app.kafka.topics.collection-events}",
            groupId = "${spring.kafka.consumer.group-id}"
    )
    public void consumeCollectionEvent(ConsumerRecord<String, CollectionEvent> record, Acknowledgment acknowledgment) {
        CollectionEvent event = record.value();

        try {
            log.debug("Consumed collection event: partition={}, offset={}, eventId={}",
                    record.partition(), record.offset(), event == null ? null : event.getEventId());

            if (event == null || event.getLoanId() == null) {
                throw new IllegalArgumentException("Collection event has no loan id");
            }

            String idempotencyKey = event.getIdempotencyKey() != null && !event.getIdempotencyKey().isBlank()
                    ? event.getIdempotencyKey()
                    : idempotencyService.generateIdempotencyKey(event.getEventId(), event.getLoanId());
            UserIdentity user = identityResolver.resolve(event.getSubmittedByEmail());

            collectionLedgerService.addCollection(event.getLoanId(), toRequest(event), idempotencyKey, user,
                    CollectionLedgerService.SOURCE_KAFKA);

            acknowledgment.acknowledge();
            count("success");
            log.info("Collection event {} applied to loan {}", event.getEventId(), event.getLoanId());

        } catch (LoanServiceException | IllegalArgumentException e) {
            log.warn("Collection event rejected: {}", e.getMessage());
            count("validation_failed");
            sendToDlq(record, e.getMessage());
            acknowledgment.acknowledge();

        } catch (Exception e) {
            log.error("Error processing collection event at offset {}: {}", record.offset(), e.getMessage(), e);
            count("error");
            sendToDlq(record, e.getMessage());
            acknowledgment.acknowledge();
        }
    }

    CollectionRequest toRequest(CollectionEvent event) {
        return CollectionRequest.builder()
                .memberName(event.getMemberName())
                .scheduledAmount(event.getScheduledAmount())
                .collectedAmount(event.getCollectedAmount())
                .advancePayment(event.getAdvancePayment())
                .fieldBalance(event.getFieldBalance())
                .currency(event.getCurrency())
                .collectionDate(event.getCollectionDate())
                .build();
    }

    private void sendToDlq(ConsumerRecord<String, CollectionEvent> record, String errorMessage) {
        try {
            log.warn("Sending collection event at offset {} to DLQ: {}", record.offset(), errorMessage);
            kafkaTemplate.send(dlqTopic, record.key(), record.value());

            Counter.builder("kafka.dlq.sent")
                    .tag("reason", "processing_failed")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("Failed to send collection event to DLQ: {}", e.getMessage(), e);
        }
    }

    private void count(String result) {
        Counter.builder("kafka.collection.events.consumed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
