package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DistributionRepository extends JpaRepository<DistributionEntity, UUID>, JpaSpecificationExecutor<DistributionEntity> {

    List<DistributionEntity> findByLoanIdOrderByCreatedAtDesc(UUID loanId);

    List<DistributionEntity> findAllByOrderByDistributionDateAscCreatedAtAsc();

    long deleteByLoanId(UUID loanId);
}
