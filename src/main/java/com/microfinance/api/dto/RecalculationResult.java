package com.microfinance.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecalculationResult {
    private boolean success;
    private int loans;
    private int distributions;
    private int events;
    private int supersededOutboxRecords;
    private int failedBatches;
}
