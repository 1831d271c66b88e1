package com.microfinance.domain.service;

import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.AuthenticationRequiredException;
import com.microfinance.exception.ForbiddenOperationException;
import com.microfinance.infrastructure.persistence.entity.GroupEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Role and ownership checks. A missing identity is unrestricted, except for
 * operations reserved to approvers.
 */
@Slf4j
@Component
public class LoanAccessPolicy {

    public void requireApprover(UserIdentity user, String action) {
        if (user == null) {
            throw new AuthenticationRequiredException("An identified admin or branch head is required to " + action);
        }
        if (!user.isApprover()) {
            log.warn("User {} with role '{}' tried to {}", user.getEmail(), user.getRole(), action);
            throw new ForbiddenOperationException("Only admins and branch heads can " + action);
        }
    }

    public boolean canAccess(UserIdentity user, LoanEntity loan) {
        return user == null || !user.isRestricted() || user.owns(loan.getCreatedByEmail(), loan.getLoanOfficerName());
    }

    public void requireAccess(UserIdentity user, LoanEntity loan) {
        if (!canAccess(user, loan)) {
            log.warn("User {} denied access to loan {}", user.getEmail(), loan.getId());
            throw new ForbiddenOperationException("Forbidden");
        }
    }

    /**
     * Restricted users only see groups they created.
     */
    public void requireAccess(UserIdentity user, GroupEntity group) {
        if (user == null || !user.isRestricted()) {
            return;
        }
        boolean own = group.getCreatedByEmail() != null && user.getEmail() != null
                && group.getCreatedByEmail().equalsIgnoreCase(user.getEmail());
        if (!own) {
            log.warn("User {} denied access to group {}", user.getEmail(), group.getId());
            throw new ForbiddenOperationException("Forbidden");
        }
    }
}
