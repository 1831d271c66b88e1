package com.microfinance.api;

import com.microfinance.api.dto.LoanConfigRequest;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.domain.service.IdentityResolver;
import com.microfinance.domain.service.LoanConfigResolver;
import com.microfinance.infrastructure.persistence.entity.LoanConfigEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;

/**
 * Per-branch loan fee configuration, with a global fallback document.
 */
@Slf4j
@RestController
@RequestMapping("/api/loan-config")
@RequiredArgsConstructor
public class LoanConfigController {

    private final LoanConfigResolver loanConfigResolver;
    private final IdentityResolver identityResolver;

    @GetMapping
    public ResponseEntity<Object> getConfig(@RequestParam(required = false) String branchCode,
                                            @RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        UserIdentity user = identityResolver.resolve(userEmail);
        String branch = branchCode != null && !branchCode.isBlank()
                ? branchCode
                : user == null ? null : user.getBranchCode();
        return ResponseEntity.ok(loanConfigResolver.findEffective(branch)
                .<Object>map(config -> config)
                .orElse(Collections.emptyMap()));
    }

    @PutMapping
    public ResponseEntity<LoanConfigEntity> upsertConfig(@Valid @RequestBody LoanConfigRequest request,
                                                         @RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        log.info("Loan config update requested for branch {}", request.getBranchCode());
        return ResponseEntity.ok(loanConfigResolver.upsert(request, identityResolver.resolve(userEmail)));
    }
}
