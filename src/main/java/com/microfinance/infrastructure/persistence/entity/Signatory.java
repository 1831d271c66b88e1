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
public class Signatory {

    @Column(length = 200)
    private String name;

    @Column(length = 50)
    private String cellphoneNumber;

    @Column(length = 10)
    private String sex;

    @Column(length = 500)
    private String address;

    @Column(length = 200)
    private String occupation;

    @Column(precision = 19, scale = 2)
    private BigDecimal monthlyIncome;
}
