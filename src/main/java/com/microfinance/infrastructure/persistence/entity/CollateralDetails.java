package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollateralDetails {

    @Column(length = 500)
    private String propertyGiven;

    @Column(length = 500)
    private String propertyLocation;

    @Column(precision = 19, scale = 2)
    private BigDecimal propertyValue;
}
