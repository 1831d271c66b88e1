package com.microfinance.domain.service;

import com.microfinance.domain.model.Money;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.SavingsAccountEntity;
import com.microfinance.infrastructure.persistence.repository.SavingsAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Moves a loan's collateral cash into the client's individual savings account
 * on activation. Keyed by the transaction reference {@code collateral:<loanId>},
 * so a repeated call deposits nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollateralDepositService {

    static final String REFERENCE_PREFIX = "collateral:";

    private final SavingsAccountRepository savingsAccountRepository;
    private final LoanMetricEvents loanMetricEvents;
    private final MetricOutboxWriter metricOutboxWriter;

    /**
     * @return true when a deposit was made
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean depositCollateral(LoanEntity loan) {
        BigDecimal amount = loan.getCollateralCashAmount();
        if (loan.getClientId() == null || !Money.isPositive(amount)) {
            return false;
        }

        SavingsAccountEntity account = savingsAccountRepository
                .findByAccountTypeAndClientId(SavingsAccountEntity.AccountType.INDIVIDUAL, loan.getClientId())
                .orElseGet(() -> SavingsAccountEntity.builder()
                        .accountType(SavingsAccountEntity.AccountType.INDIVIDUAL)
                        .clientId(loan.getClientId())
                        .groupId(loan.getGroupId())
                        .branchName(loan.getBranchName())
                        .branchCode(loan.getBranchCode())
                        .currency(loan.getCurrency())
                        .build());

        String reference = REFERENCE_PREFIX + loan.getId();
        if (account.hasTransactionWithReference(reference)) {
            log.debug("Collateral for loan {} already deposited", loan.getId());
            return false;
        }

        LocalDate date = loan.getDisbursementDate() != null ? loan.getDisbursementDate() : LocalDate.now();
        account.deposit(amount, reference, date);
        savingsAccountRepository.saveAndFlush(account);

        metricOutboxWriter.enqueue(String.valueOf(loan.getId()), loanMetricEvents.collateralDeposit(loan, amount));
        log.info("Collateral {} {} deposited for loan {} into savings account of client {}",
                amount, loan.getCurrency(), loan.getId(), loan.getClientId());
        return true;
    }
}
