package com.microfinance.api.dto;

import com.microfinance.domain.model.LoanStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    @NotNull(message = "Invalid status")
    private LoanStatus status;
}
