package com.microfinance.domain.service;

import com.microfinance.api.dto.LoanConfigRequest;
import com.microfinance.domain.model.EffectiveLoanConfig;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.infrastructure.persistence.entity.LoanConfigEntity;
import com.microfinance.infrastructure.persistence.entity.LoanTypeConfig;
import com.microfinance.infrastructure.persistence.repository.LoanConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Two-tier fee configuration lookup: the branch document, else the global one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanConfigResolver {

    private final LoanConfigRepository loanConfigRepository;
    private final LoanAccessPolicy accessPolicy;

    /**
     * Effective configuration for a branch. Never fails: a lookup error yields the
     * empty configuration and the calculator falls back to its built-in constants.
     * Runs outside the caller's transaction so a failed lookup cannot poison it.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public EffectiveLoanConfig resolve(String branchCode) {
        try {
            return findEffective(branchCode)
                    .map(EffectiveLoanConfig::from)
                    .orElseGet(EffectiveLoanConfig::empty);
        } catch (Exception e) {
            log.error("Loan config lookup failed for branch {}, using built-in defaults: {}", branchCode, e.getMessage(), e);
            return EffectiveLoanConfig.empty();
        }
    }

    @Transactional(readOnly = true)
    public Optional<LoanConfigEntity> findEffective(String branchCode) {
        if (branchCode != null && !branchCode.isBlank()) {
            Optional<LoanConfigEntity> specific = loanConfigRepository.findByBranchCode(branchCode);
            if (specific.isPresent()) {
                return specific;
            }
        }
        return loanConfigRepository.findFirstByBranchCodeIsNull();
    }

    /**
     * Create or replace the configuration of one branch, or of the global document
     * when no branch applies. Approvers only.
     */
    @Transactional
    public LoanConfigEntity upsert(LoanConfigRequest request, UserIdentity user) {
        accessPolicy.requireApprover(user, "update loan configuration");

        String branchCode = request.getBranchCode();
        if (branchCode == null || branchCode.isBlank()) {
            branchCode = user.getBranchCode();
        }
        if (branchCode != null && branchCode.isBlank()) {
            branchCode = null;
        }

        LoanConfigEntity config = (branchCode != null
                ? loanConfigRepository.findByBranchCode(branchCode)
                : loanConfigRepository.findFirstByBranchCodeIsNull())
                .orElseGet(LoanConfigEntity::new);

        config.setBranchCode(branchCode);
        config.setExpress(orEmpty(request.getExpress()));
        config.setIndividual(orEmpty(request.getIndividual()));
        config.setGroup(orEmpty(request.getGroup()));
        config.setUpdatedBy(user.getEmail() != null ? user.getEmail()
                : user.getUsername() != null ? user.getUsername() : "system");

        LoanConfigEntity saved = loanConfigRepository.save(config);
        log.info("Loan config upserted for {} by {}", branchCode == null ? "global" : branchCode, saved.getUpdatedBy());
        return saved;
    }

    private static LoanTypeConfig orEmpty(LoanTypeConfig config) {
        return config == null ? new LoanTypeConfig() : config;
    }
}
