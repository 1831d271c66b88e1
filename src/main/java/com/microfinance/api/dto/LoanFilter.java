package com.microfinance.api.dto;

import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanFilter {
    private String branchName;
    private String branchCode;
    private LoanCategory category;
    private LoanStatus status;
    private UUID groupId;
}
