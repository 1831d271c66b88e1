package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, UUID>, JpaSpecificationExecutor<LoanEntity> {

    List<LoanEntity> findAllByOrderByCreatedAtAsc();

    List<LoanEntity> findByGroupIdOrderByCreatedAtDesc(UUID groupId);

    List<LoanEntity> findByStatus(LoanStatus status);

    @Query("SELECT COALESCE(SUM(l.loanAmount), 0) FROM LoanEntity l WHERE l.groupId = :groupId AND l.category = :category")
    BigDecimal sumPrincipalByGroupAndCategory(@Param("groupId") UUID groupId, @Param("category") LoanCategory category);

    /**
     * Principal sum of individual member loans linked to the group.
     */
    default BigDecimal sumIndividualPrincipalByGroup(UUID groupId) {
        return sumPrincipalByGroupAndCategory(groupId, LoanCategory.INDIVIDUAL);
    }
}
