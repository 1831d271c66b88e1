package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.infrastructure.persistence.entity.LoanAgreementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanAgreementRepository extends JpaRepository<LoanAgreementEntity, UUID> {

    Optional<LoanAgreementEntity> findByLoanId(UUID loanId);

    long deleteByLoanId(UUID loanId);
}
