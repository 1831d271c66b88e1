package com.microfinance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Borrower record. Maintained by the client registry; read here for member names.
 */
@Entity
@Table(name = "clients")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 200)
    private String memberName;

    @Column(length = 50)
    private String passbookNumber;

    @Column(length = 100)
    private String branchName;

    @Column(length = 50)
    private String branchCode;
}
