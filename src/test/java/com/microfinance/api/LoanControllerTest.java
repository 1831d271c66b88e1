package com.microfinance.api;

import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.domain.service.CollectionLedgerService;
import com.microfinance.domain.service.DistributionLedgerService;
import com.microfinance.domain.service.DueCollectionService;
import com.microfinance.domain.service.IdentityResolver;
import com.microfinance.domain.service.LoanLifecycleService;
import com.microfinance.domain.service.LoanService;
import com.microfinance.exception.AuthenticationRequiredException;
import com.microfinance.exception.ForbiddenOperationException;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.exception.ResourceNotFoundException;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LoanController.class)
class LoanControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private LoanService loanService;
    @MockBean private LoanLifecycleService loanLifecycleService;
    @MockBean private CollectionLedgerService collectionLedgerService;
    @MockBean private DistributionLedgerService distributionLedgerService;
    @MockBean private DueCollectionService dueCollectionService;
    @MockBean private IdentityResolver identityResolver;

    @Test
    void getLoan_resolvesCallerFromHeader() throws Exception {
        UUID id = UUID.randomUUID();
        UserIdentity officer = UserIdentity.builder().email("officer@mfi.lr").role("loan officer").build();
        LoanEntity loan = LoanEntity.builder()
                .id(id)
                .branchCode("MON")
                .category(LoanCategory.INDIVIDUAL)
                .status(LoanStatus.PENDING)
                .loanAmount(new BigDecimal("10000"))
                .build();
        when(identityResolver.resolve("officer@mfi.lr")).thenReturn(officer);
        when(loanService.get(id, officer)).thenReturn(loan);

        mockMvc.perform(get("/api/loans/{id}", id).header("x-user-email", "officer@mfi.lr"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.branchCode").value("MON"));
    }

    @Test
    void getLoan_missingLoanIs404() throws Exception {
        UUID id = UUID.randomUUID();
        when(loanService.get(eq(id), any())).thenThrow(ResourceNotFoundException.loan(id));

        mockMvc.perform(get("/api/loans/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("Resource Not Found"));
    }

    @Test
    void getLoan_foreignLoanIs403() throws Exception {
        UUID id = UUID.randomUUID();
        when(loanService.get(eq(id), any())).thenThrow(new ForbiddenOperationException("Forbidden"));

        mockMvc.perform(get("/api/loans/{id}", id))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Forbidden"));
    }

    @Test
    void initAgreement_anonymousCallerIs401() throws Exception {
        UUID id = UUID.randomUUID();
        when(loanLifecycleService.initAgreement(eq(id), isNull()))
                .thenThrow(new AuthenticationRequiredException("An identified admin or branch head is required"));

        mockMvc.perform(post("/api/loans/{id}/agreement/init", id))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401));
    }

    @Test
    void listLoans_unknownStatusIs400() throws Exception {
        mockMvc.perform(get("/api/loans").param("status", "archived"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid status: archived"));
        verifyNoInteractions(loanService);
    }

    @Test
    void createDistribution_fieldErrorsAreReturned() throws Exception {
        UUID id = UUID.randomUUID();
        when(distributionLedgerService.create(eq(id), any(), any()))
                .thenThrow(new LoanValidationException(Map.of("entries[1].currency", "must match the loan currency (LRD)")));

        mockMvc.perform(post("/api/loans/{id}/distributions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entries\":[{\"amount\":500,\"currency\":\"LRD\"},{\"amount\":300,\"currency\":\"USD\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors['entries[1].currency']").value("must match the loan currency (LRD)"));
    }

    @Test
    void createDistribution_negativeAmountFailsBeanValidation() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(post("/api/loans/{id}/distributions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":-5,\"currency\":\"LRD\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors.amount").exists());
        verifyNoInteractions(distributionLedgerService);
    }
}
