package com.microfinance.domain.service;

import com.microfinance.domain.model.UserIdentity;
import com.microfinance.infrastructure.persistence.repository.StaffUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves identities from the staff directory table by email.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaffDirectoryIdentityResolver implements IdentityResolver {

    private final StaffUserRepository staffUserRepository;

    @Override
    @Transactional(readOnly = true)
    public UserIdentity resolve(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return staffUserRepository.findByEmailIgnoreCase(email.trim())
                .map(staff -> UserIdentity.builder()
                        .email(staff.getEmail())
                        .username(staff.getUsername())
                        .role(staff.getRole())
                        .branchName(staff.getBranchName())
                        .branchCode(staff.getBranchCode())
                        .build())
                .orElseGet(() -> {
                    log.debug("No staff user for {}", email);
                    return null;
                });
    }
}
