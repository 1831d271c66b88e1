package com.microfinance.api;

import com.microfinance.api.dto.CollectionBatchRequest;
import com.microfinance.api.dto.CollectionRequest;
import com.microfinance.api.dto.DistributionRequest;
import com.microfinance.api.dto.DueCollectionItem;
import com.microfinance.api.dto.LoanFilter;
import com.microfinance.api.dto.LoanRequest;
import com.microfinance.api.dto.StatusChangeRequest;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.domain.service.CollectionLedgerService;
import com.microfinance.domain.service.DistributionLedgerService;
import com.microfinance.domain.service.DueCollectionService;
import com.microfinance.domain.service.IdentityResolver;
import com.microfinance.domain.service.LoanLifecycleService;
import com.microfinance.domain.service.LoanService;
import com.microfinance.infrastructure.persistence.entity.DistributionEntity;
import com.microfinance.infrastructure.persistence.entity.LoanAgreementEntity;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for loans and the ledgers hanging off them.
 *
 * The caller is identified by the {@code x-user-email} header; an unknown or
 * missing caller is unrestricted except where approval is required.
 */
@Slf4j
@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
public class LoanController {

    static final String USER_HEADER = "x-user-email";

    private final LoanService loanService;
    private final LoanLifecycleService loanLifecycleService;
    private final CollectionLedgerService collectionLedgerService;
    private final DistributionLedgerService distributionLedgerService;
    private final DueCollectionService dueCollectionService;
    private final IdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<LoanEntity> createLoan(@Valid @RequestBody LoanRequest request,
                                                 @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        log.info("Received loan request: category={}, branch={}", request.getCategory(), request.getBranchCode());
        LoanEntity loan = loanService.create(request, identityResolver.resolve(userEmail));
        return ResponseEntity.status(HttpStatus.CREATED).body(loan);
    }

    @GetMapping
    public ResponseEntity<List<LoanEntity>> listLoans(@RequestParam(required = false) String branchName,
                                                      @RequestParam(required = false) String branchCode,
                                                      @RequestParam(required = false) String category,
                                                      @RequestParam(required = false) String status,
                                                      @RequestParam(required = false) UUID groupId,
                                                      @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        LoanFilter filter = LoanFilter.builder()
                .branchName(branchName)
                .branchCode(branchCode)
                .category(LoanCategory.fromWireName(category))
                .status(LoanStatus.fromWireName(status))
                .groupId(groupId)
                .build();
        return ResponseEntity.ok(loanService.list(filter, identityResolver.resolve(userEmail)));
    }

    @GetMapping("/due-collections")
    public ResponseEntity<List<DueCollectionItem>> dueCollections(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String branchCode,
            @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(dueCollectionService.dueCollections(from, to, branchCode, identityResolver.resolve(userEmail)));
    }

    @GetMapping("/by-group/{groupId}")
    public ResponseEntity<List<LoanEntity>> listByGroup(@PathVariable UUID groupId,
                                                        @RequestParam(required = false) String category,
                                                        @RequestParam(required = false) String status,
                                                        @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(loanService.listByGroup(groupId, LoanCategory.fromWireName(category),
                LoanStatus.fromWireName(status), identityResolver.resolve(userEmail)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LoanEntity> getLoan(@PathVariable UUID id,
                                              @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(loanService.get(id, identityResolver.resolve(userEmail)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<LoanEntity> updateLoan(@PathVariable UUID id,
                                                 @Valid @RequestBody LoanRequest request,
                                                 @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(loanService.update(id, request, identityResolver.resolve(userEmail)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteLoan(@PathVariable UUID id,
                                                          @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        loanService.delete(id, identityResolver.resolve(userEmail));
        return ResponseEntity.ok(Map.of("success", true, "id", id));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<LoanEntity> changeStatus(@PathVariable UUID id,
                                                   @Valid @RequestBody StatusChangeRequest request,
                                                   @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        log.info("Status change requested for loan {}: {}", id, request.getStatus());
        return ResponseEntity.ok(loanLifecycleService.changeStatus(id, request.getStatus(), identityResolver.resolve(userEmail)));
    }

    @PostMapping("/{id}/collections")
    public ResponseEntity<LoanEntity> addCollection(@PathVariable UUID id,
                                                    @Valid @RequestBody CollectionRequest request,
                                                    @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
                                                    @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        UserIdentity user = identityResolver.resolve(userEmail);
        return ResponseEntity.ok(collectionLedgerService.addCollection(id, request, idempotencyKey, user,
                CollectionLedgerService.SOURCE_API));
    }

    @PostMapping("/{id}/collections/batch")
    public ResponseEntity<LoanEntity> addCollectionsBatch(@PathVariable UUID id,
                                                          @Valid @RequestBody CollectionBatchRequest request,
                                                          @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
                                                          @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(collectionLedgerService.addCollectionsBatch(id, request.getEntries(), idempotencyKey,
                identityResolver.resolve(userEmail)));
    }

    @GetMapping("/{id}/distributions")
    public ResponseEntity<List<DistributionEntity>> listDistributions(@PathVariable UUID id,
                                                                      @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(distributionLedgerService.listByLoan(id, identityResolver.resolve(userEmail)));
    }

    @PostMapping("/{id}/distributions")
    public ResponseEntity<List<DistributionEntity>> createDistributions(@PathVariable UUID id,
                                                                        @Valid @RequestBody DistributionRequest request,
                                                                        @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        List<DistributionEntity> created = distributionLedgerService.create(id, request, identityResolver.resolve(userEmail));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}/agreement")
    public ResponseEntity<LoanAgreementEntity> getAgreement(@PathVariable UUID id,
                                                            @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(loanLifecycleService.getAgreement(id, identityResolver.resolve(userEmail)));
    }

    @PostMapping("/{id}/agreement/init")
    public ResponseEntity<LoanAgreementEntity> initAgreement(@PathVariable UUID id,
                                                             @RequestHeader(value = USER_HEADER, required = false) String userEmail) {
        return ResponseEntity.ok(loanLifecycleService.initAgreement(id, identityResolver.resolve(userEmail)));
    }
}
