package com.microfinance.domain.service;

import com.microfinance.api.dto.LoanConfigRequest;
import com.microfinance.domain.model.EffectiveLoanConfig;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.AuthenticationRequiredException;
import com.microfinance.exception.ForbiddenOperationException;
import com.microfinance.infrastructure.persistence.entity.LoanConfigEntity;
import com.microfinance.infrastructure.persistence.entity.LoanTypeConfig;
import com.microfinance.infrastructure.persistence.repository.LoanConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoanConfigResolverTest {

    @Mock private LoanConfigRepository loanConfigRepository;

    private LoanConfigResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LoanConfigResolver(loanConfigRepository, new LoanAccessPolicy());
    }

    @Test
    void resolve_prefersBranchDocument() {
        LoanConfigEntity branch = LoanConfigEntity.builder()
                .branchCode("MON")
                .individual(LoanTypeConfig.builder().processingFeePercent(new BigDecimal("5")).build())
                .build();
        when(loanConfigRepository.findByBranchCode("MON")).thenReturn(Optional.of(branch));

        EffectiveLoanConfig config = resolver.resolve("MON");

        assertEquals("MON", config.getSourceBranchCode());
        assertEquals(new BigDecimal("5"), config.getIndividual().getProcessingFeePercent());
        assertNotNull(config.getGroup());
        verify(loanConfigRepository, never()).findFirstByBranchCodeIsNull();
    }

    @Test
    void resolve_fallsBackToGlobalDocument() {
        LoanConfigEntity global = LoanConfigEntity.builder().build();
        when(loanConfigRepository.findByBranchCode("GBA")).thenReturn(Optional.empty());
        when(loanConfigRepository.findFirstByBranchCodeIsNull()).thenReturn(Optional.of(global));

        EffectiveLoanConfig config = resolver.resolve("GBA");

        assertNull(config.getSourceBranchCode());
        assertNotNull(config.getExpress());
    }

    @Test
    void resolve_lookupFailureYieldsEmptyConfig() {
        when(loanConfigRepository.findByBranchCode("MON"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        EffectiveLoanConfig config = resolver.resolve("MON");

        assertNull(config.getIndividual().getProcessingFeePercent());
    }

    @Test
    void upsert_defaultsBranchToCallerAndRecordsAuthor() {
        UserIdentity head = UserIdentity.builder()
                .email("head@branch.lr").role("Branch Head").branchCode("MON").build();
        when(loanConfigRepository.findByBranchCode("MON")).thenReturn(Optional.empty());
        when(loanConfigRepository.save(any(LoanConfigEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        LoanConfigEntity saved = resolver.upsert(LoanConfigRequest.builder()
                .group(LoanTypeConfig.builder().formFeeAmountLrd(new BigDecimal("250")).build())
                .build(), head);

        assertEquals("MON", saved.getBranchCode());
        assertEquals("head@branch.lr", saved.getUpdatedBy());
        assertEquals(new BigDecimal("250"), saved.getGroup().getFormFeeAmountLrd());
        assertNotNull(saved.getIndividual());
    }

    @Test
    void upsert_rejectsNonApprovers() {
        UserIdentity officer = UserIdentity.builder().email("officer@branch.lr").role("loan officer").build();

        assertThrows(ForbiddenOperationException.class,
                () -> resolver.upsert(LoanConfigRequest.builder().build(), officer));
        assertThrows(AuthenticationRequiredException.class,
                () -> resolver.upsert(LoanConfigRequest.builder().build(), null));
        verifyNoInteractions(loanConfigRepository);
    }
}
