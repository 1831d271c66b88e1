package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the borrower's personal details at loan time.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditorInfo {

    @Column(length = 200)
    private String nameOfCreditor;

    @Column(length = 10)
    private String creditorSex;

    @Column(length = 100)
    private String creditorContacts;

    @Column(length = 200)
    private String typeOfBusinessOrJob;

    @Column(length = 500)
    private String homeAddress;

    @Column(length = 500)
    private String businessAddress;

    @Column(length = 200)
    private String placeOfBirth;

    private Integer numberOfChildren;
}
