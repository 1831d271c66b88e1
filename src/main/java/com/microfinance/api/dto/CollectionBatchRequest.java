package com.microfinance.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionBatchRequest {

    @NotEmpty(message = "entries array is required")
    private List<@Valid CollectionRequest> entries;
}
