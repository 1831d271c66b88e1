package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.infrastructure.persistence.entity.SavingsAccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SavingsAccountRepository extends JpaRepository<SavingsAccountEntity, UUID> {

    Optional<SavingsAccountEntity> findByAccountTypeAndClientId(SavingsAccountEntity.AccountType accountType, UUID clientId);
}
