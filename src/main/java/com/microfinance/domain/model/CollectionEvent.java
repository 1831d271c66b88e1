package com.microfinance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Field collection submitted by a mobile agent over Kafka.
 *
 * Delivery is at-least-once; {@code idempotencyKey} identifies resubmissions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionEvent {

    private UUID eventId;
    private UUID loanId;
    private String idempotencyKey;
    private String submittedByEmail;
    private String memberName;
    private BigDecimal scheduledAmount;
    private BigDecimal collectedAmount;
    private BigDecimal advancePayment;
    private BigDecimal fieldBalance;
    private Currency currency;
    private LocalDate collectionDate;
}
