package com.microfinance.api;

import com.microfinance.api.dto.DistributionEntryRequest;
import com.microfinance.domain.service.DistributionLedgerService;
import com.microfinance.domain.service.IdentityResolver;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Distribution tranches across loans. Creation lives under {@code /api/loans/{id}/distributions}.
 */
@Slf4j
@RestController
@RequestMapping("/api/distributions")
@RequiredArgsConstructor
public class DistributionController {

    private final DistributionLedgerService distributionLedgerService;
    private final IdentityResolver identityResolver;

    @GetMapping
    public ResponseEntity<List<DistributionEntity>> listDistributions(@RequestParam(required = false) String branchName,
                                                                      @RequestParam(required = false) String branchCode,
                                                                      @RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(distributionLedgerService.list(branchName, branchCode, identityResolver.resolve(userEmail)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DistributionEntity> updateDistribution(@PathVariable UUID id,
                                                                 @Valid @RequestBody DistributionEntryRequest request,
                                                                 @RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(distributionLedgerService.update(id, request, identityResolver.resolve(userEmail)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteDistribution(@PathVariable UUID id,
                                                                  @RequestHeader(value = LoanController.USER_HEADER, required = false) String userEmail) {
        distributionLedgerService.delete(id, identityResolver.resolve(userEmail));
        return ResponseEntity.ok(Map.of("success", true, "id", id));
    }
}
