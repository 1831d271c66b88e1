package com.microfinance.domain.service;

import com.microfinance.infrastructure.persistence.entity.GroupEntity;
import com.microfinance.infrastructure.persistence.repository.GroupRepository;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Maintains the cached {@code groupLoanTotal}: the principal sum of individual
 * member loans linked to the group. Always recomputed from loans, never adjusted
 * incrementally.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupLoanTotalService {

    private final LoanRepository loanRepository;
    private final GroupRepository groupRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<BigDecimal> recalculate(UUID groupId) {
        if (groupId == null) {
            return Optional.empty();
        }
        Optional<GroupEntity> group = groupRepository.findById(groupId);
        if (group.isEmpty()) {
            log.warn("Group {} not found, loan total not updated", groupId);
            return Optional.empty();
        }
        BigDecimal total = loanRepository.sumIndividualPrincipalByGroup(groupId);
        GroupEntity entity = group.get();
        entity.setGroupLoanTotal(total == null ? BigDecimal.ZERO : total);
        groupRepository.save(entity);
        log.info("Group {} loan total recalculated: {}", groupId, entity.getGroupLoanTotal());
        return Optional.of(entity.getGroupLoanTotal());
    }
}
