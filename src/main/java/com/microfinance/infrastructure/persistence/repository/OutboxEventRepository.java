package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.infrastructure.persistence.entity.OutboxEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    List<OutboxEventEntity> findByStatusInAndRetryCountLessThanOrderByCreatedAtAsc(
            Collection<OutboxEventEntity.EventStatus> statuses, int maxRetries, Pageable pageable);

    /**
     * Mark unapplied records of the given type as superseded so the relay never applies them.
     */
    @Modifying
    @Query("UPDATE OutboxEventEntity o SET o.status = :superseded " +
           "WHERE o.eventType = :eventType AND o.status IN :statuses")
    int supersede(@Param("eventType") String eventType,
                  @Param("statuses") Collection<OutboxEventEntity.EventStatus> statuses,
                  @Param("superseded") OutboxEventEntity.EventStatus superseded);

    /**
     * Supersede the unapplied records of one aggregate, used when the aggregate is deleted.
     */
    @Modifying
    @Query("UPDATE OutboxEventEntity o SET o.status = :superseded " +
           "WHERE o.aggregateId = :aggregateId AND o.status IN :statuses")
    int supersedeForAggregate(@Param("aggregateId") String aggregateId,
                              @Param("statuses") Collection<OutboxEventEntity.EventStatus> statuses,
                              @Param("superseded") OutboxEventEntity.EventStatus superseded);
}
