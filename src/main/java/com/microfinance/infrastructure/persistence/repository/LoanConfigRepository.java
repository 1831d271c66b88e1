package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.infrastructure.persistence.entity.LoanConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanConfigRepository extends JpaRepository<LoanConfigEntity, UUID> {

    Optional<LoanConfigEntity> findByBranchCode(String branchCode);

    /**
     * The global default document, i.e. the one without a branch code.
     */
    Optional<LoanConfigEntity> findFirstByBranchCodeIsNull();
}
