package com.microfinance.api.dto;

import com.microfinance.infrastructure.persistence.entity.LoanTypeConfig;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upsert body for a branch (or the global) fee configuration.
 * Missing category blocks are stored empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanConfigRequest {

    private String branchCode;

    @Valid
    private LoanTypeConfig express;

    @Valid
    private LoanTypeConfig individual;

    @Valid
    private LoanTypeConfig group;
}
