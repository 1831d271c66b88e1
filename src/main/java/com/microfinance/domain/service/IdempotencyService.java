package com.microfinance.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microfinance.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.microfinance.infrastructure.persistence.repository.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Duplicate detection for collection submissions.
 *
 * Field agents retry on flaky connections and Kafka redelivers; a key seen
 * inside the window is acknowledged without appending to the ledger again.
 * The record is written in the same transaction as the append, and the unique
 * key column rejects a concurrent duplicate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final IdempotencyRecordRepository idempotencyRepository;
    private final ObjectMapper objectMapper;

    @Value("${app.collections.idempotency-window-hours:72}")
    private int idempotencyWindowHours;

    /**
     * @return the stored record when the key was already processed and has not expired
     */
    @Transactional(readOnly = true)
    public Optional<IdempotencyRecordEntity> checkDuplicate(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        Optional<IdempotencyRecordEntity> record = idempotencyRepository.findByIdempotencyKey(idempotencyKey);

        if (record.isPresent()) {
            IdempotencyRecordEntity entity = record.get();

            if (entity.isExpired()) {
                log.debug("Idempotency record expired for key: {}", idempotencyKey);
                return Optional.empty();
            }

            log.info("Duplicate collection submission detected for key: {}", idempotencyKey);
            return Optional.of(entity);
        }

        return Optional.empty();
    }

    @Transactional
    public void storeIdempotencyRecord(String idempotencyKey, UUID loanId, Object response) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return;
        }
        try {
            String responseJson = objectMapper.writeValueAsString(response);

            IdempotencyRecordEntity record = idempotencyRepository.findByIdempotencyKey(idempotencyKey)
                    .orElseGet(IdempotencyRecordEntity::new);
            record.setIdempotencyKey(idempotencyKey);
            record.setLoanId(loanId);
            record.setResponse(responseJson);
            record.setExpiresAt(Instant.now().plus(idempotencyWindowHours, ChronoUnit.HOURS));

            idempotencyRepository.save(record);

            log.debug("Stored idempotency record for key: {}", idempotencyKey);

        } catch (Exception e) {
            log.error("Error storing idempotency record: {}", e.getMessage(), e);
        }
    }

    /**
     * Key for a collection message without an explicit key.
     */
    public String generateIdempotencyKey(UUID eventId, UUID loanId) {
        return String.format("collection:%s:%s", loanId, eventId);
    }
}
