package com.microfinance.infrastructure.persistence.entity;

import com.microfinance.domain.model.Currency;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Savings account holding collateral cash and voluntary savings.
 * One individual account per client, enforced by the unique constraint.
 */
@Entity
@Table(name = "savings_accounts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_savings_type_client", columnNames = {"accountType", "clientId"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsAccountEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AccountType accountType = AccountType.INDIVIDUAL;

    @Column(columnDefinition = "UUID")
    private UUID clientId;

    @Column(columnDefinition = "UUID")
    private UUID groupId;

    @Column(nullable = false, length = 100)
    private String branchName;

    @Column(nullable = false, length = 50)
    private String branchCode;

    @Builder.Default
    private Integer loanCycle = 1;

    @Column(nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal currentBalance = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    @Builder.Default
    private Currency currency = Currency.LRD;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "savings_transactions", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<SavingsTransaction> transactions = new ArrayList<>();

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum AccountType {
        INDIVIDUAL, GROUP
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean hasTransactionWithReference(String reference) {
        return transactions.stream().anyMatch(t -> reference.equals(t.getReference()));
    }

    /**
     * Credit the account and append the matching transaction.
     */
    public SavingsTransaction deposit(BigDecimal amount, String reference, LocalDate date) {
        BigDecimal balance = (currentBalance == null ? BigDecimal.ZERO : currentBalance).add(amount);
        SavingsTransaction transaction = SavingsTransaction.builder()
                .transactionDate(date)
                .savingAmount(amount)
                .withdrawalAmount(BigDecimal.ZERO)
                .balance(balance)
                .currency(currency)
                .reference(reference)
                .branchName(branchName)
                .branchCode(branchCode)
                .build();
        transactions.add(transaction);
        currentBalance = balance;
        return transaction;
    }
}
