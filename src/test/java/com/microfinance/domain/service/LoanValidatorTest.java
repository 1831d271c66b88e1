package com.microfinance.domain.service;

import com.microfinance.domain.model.Currency;
import com.microfinance.domain.model.DurationUnit;
import com.microfinance.domain.model.LoanCategory;
import com.microfinance.domain.model.PaymentPlan;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.Signatory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LoanValidatorTest {

    private LoanValidator validator;

    @BeforeEach
    void setUp() {
        validator = new LoanValidator();
    }

    @Test
    void normalize_expressLoanDropsGroupAndForcesOneMonth() {
        LoanEntity loan = baseLoan(LoanCategory.EXPRESS)
                .groupId(UUID.randomUUID())
                .clientIds(new ArrayList<>(List.of(UUID.randomUUID())))
                .loanDurationNumber(6)
                .loanDurationUnit(DurationUnit.WEEKS)
                .build();

        validator.normalizeForCategory(loan);

        assertNull(loan.getGroupId());
        assertTrue(loan.getClientIds().isEmpty());
        assertEquals(1, loan.getLoanDurationNumber());
        assertEquals(DurationUnit.MONTHS, loan.getLoanDurationUnit());
        assertDoesNotThrow(() -> validator.validate(loan));
    }

    @Test
    void normalize_groupLoanDropsSingleClient() {
        LoanEntity loan = baseLoan(LoanCategory.GROUP)
                .groupId(UUID.randomUUID())
                .clientIds(new ArrayList<>(List.of(UUID.randomUUID())))
                .clientId(UUID.randomUUID())
                .paymentPlan(PaymentPlan.WEEKLY)
                .build();

        validator.normalizeForCategory(loan);

        assertNull(loan.getClientId());
        assertDoesNotThrow(() -> validator.validate(loan));
    }

    @Test
    void validate_groupLoanRequiresGroupAndMembers() {
        LoanEntity loan = baseLoan(LoanCategory.GROUP).paymentPlan(PaymentPlan.WEEKLY).build();

        LoanValidationException ex = assertThrows(LoanValidationException.class, () -> validator.validate(loan));

        assertTrue(ex.getFieldErrors().containsKey("groupId"));
        assertTrue(ex.getFieldErrors().containsKey("clientIds"));
    }

    @Test
    void validate_standaloneIndividualLoanRequiresGuarantor() {
        LoanEntity loan = baseLoan(LoanCategory.INDIVIDUAL)
                .clientId(UUID.randomUUID())
                .paymentPlan(PaymentPlan.WEEKLY)
                .build();

        LoanValidationException ex = assertThrows(LoanValidationException.class, () -> validator.validate(loan));
        assertEquals(List.of("guarantors"), new ArrayList<>(ex.getFieldErrors().keySet()));

        loan.getGuarantors().add(Signatory.builder().name("Musu Kollie").build());
        assertDoesNotThrow(() -> validator.validate(loan));
    }

    @Test
    void validate_groupMemberLoanNeedsNoGuarantor() {
        LoanEntity loan = baseLoan(LoanCategory.INDIVIDUAL)
                .clientId(UUID.randomUUID())
                .groupId(UUID.randomUUID())
                .paymentPlan(PaymentPlan.MONTHLY)
                .build();

        assertDoesNotThrow(() -> validator.validate(loan));
    }

    @Test
    void validate_rejectsMissingCommonFields() {
        LoanEntity loan = LoanEntity.builder()
                .category(LoanCategory.EXPRESS)
                .loanAmount(BigDecimal.ZERO)
                .interestRate(new BigDecimal("-1"))
                .loanDurationNumber(1)
                .loanDurationUnit(DurationUnit.MONTHS)
                .build();

        LoanValidationException ex = assertThrows(LoanValidationException.class, () -> validator.validate(loan));

        assertTrue(ex.getFieldErrors().containsKey("branchName"));
        assertTrue(ex.getFieldErrors().containsKey("loanOfficerName"));
        assertTrue(ex.getFieldErrors().containsKey("loanAmount"));
        assertTrue(ex.getFieldErrors().containsKey("interestRate"));
    }

    private static LoanEntity.LoanEntityBuilder baseLoan(LoanCategory category) {
        return LoanEntity.builder()
                .branchName("Monrovia Central")
                .branchCode("MON")
                .loanOfficerName("jkollie")
                .category(category)
                .loanAmount(new BigDecimal("5000"))
                .interestRate(new BigDecimal("10"))
                .currency(Currency.LRD);
    }
}
