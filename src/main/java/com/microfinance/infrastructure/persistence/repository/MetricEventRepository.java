package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.MetricName;
import com.microfinance.domain.model.MetricTotal;
import com.microfinance.infrastructure.persistence.entity.MetricEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface MetricEventRepository extends JpaRepository<MetricEventEntity, UUID> {

    boolean existsByOutboxEventId(UUID outboxEventId);

    List<MetricEventEntity> findByLoanIdOrderByEventDateAsc(UUID loanId);

    @Modifying
    @Query("DELETE FROM MetricEventEntity m WHERE m.metric IN :metrics")
    int deleteByMetricIn(@Param("metrics") Collection<MetricName> metrics);

    @Modifying
    @Query("DELETE FROM MetricEventEntity m WHERE m.loanId = :loanId")
    int deleteByLoanId(@Param("loanId") UUID loanId);

    @Query("SELECT new com.microfinance.domain.model.MetricTotal(m.metric, m.currency, SUM(m.value), COUNT(m)) " +
           "FROM MetricEventEntity m " +
           "WHERE m.metric IN :metrics AND m.eventDate >= :dateFrom AND m.eventDate <= :dateTo " +
           "AND (:branchCode IS NULL OR m.branchCode = :branchCode) " +
           "AND (:loanOfficerName IS NULL OR m.loanOfficerName = :loanOfficerName) " +
           "AND (:currency IS NULL OR m.currency = :currency) " +
           "GROUP BY m.metric, m.currency ORDER BY m.metric, m.currency")
    List<MetricTotal> summarize(@Param("metrics") Collection<MetricName> metrics,
                                @Param("dateFrom") LocalDate dateFrom,
                                @Param("dateTo") LocalDate dateTo,
                                @Param("branchCode") String branchCode,
                                @Param("loanOfficerName") String loanOfficerName,
                                @Param("currency") Currency currency);
}
