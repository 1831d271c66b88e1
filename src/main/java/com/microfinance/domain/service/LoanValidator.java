package com.microfinance.domain.service;

import com.microfinance.domain.model.DurationUnit;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.entity.Signatory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Category rules for the loan aggregate.
 *
 * <ul>
 *   <li>group: a group and at least one client, never a single client</li>
 *   <li>individual: a client, and a guarantor unless the loan belongs to a group</li>
 *   <li>express: exactly one month, no group and no client list</li>
 * </ul>
 */
@Component
public class LoanValidator {

    static final int EXPRESS_DURATION_MONTHS = 1;

    /**
     * Drop relations that contradict the category and force fixed terms.
     */
    public void normalizeForCategory(LoanEntity loan) {
        if (loan.getClientIds() != null) {
            loan.getClientIds().removeIf(id -> id == null);
        }
        if (loan.getCategory() == null) {
            return;
        }
        switch (loan.getCategory()) {
            case GROUP:
                loan.setClientId(null);
                break;
            case INDIVIDUAL:
                clearClientIds(loan);
                break;
            case EXPRESS:
                loan.setGroupId(null);
                clearClientIds(loan);
                loan.setLoanDurationNumber(EXPRESS_DURATION_MONTHS);
                loan.setLoanDurationUnit(DurationUnit.MONTHS);
                break;
            default:
                throw new IllegalStateException("Unhandled loan category: " + loan.getCategory());
        }
    }

    public void validate(LoanEntity loan) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (isBlank(loan.getBranchName()) || isBlank(loan.getBranchCode())) {
            errors.put("branchName", "branchName and branchCode are required");
        }
        if (isBlank(loan.getLoanOfficerName())) {
            errors.put("loanOfficerName", "is required");
        }
        if (loan.getLoanAmount() == null || loan.getLoanAmount().signum() <= 0) {
            errors.put("loanAmount", "must be greater than 0");
        }
        if (loan.getInterestRate() == null || loan.getInterestRate().compareTo(BigDecimal.ZERO) < 0) {
            errors.put("interestRate", "is required and must not be negative");
        }
        if (loan.getCurrency() == null) {
            errors.put("currency", "is required");
        }
        if (loan.getLoanDurationNumber() != null && loan.getLoanDurationNumber() < 0) {
            errors.put("loanDurationNumber", "must not be negative");
        }

        if (loan.getCategory() == null) {
            errors.put("category", "is required");
        } else {
            switch (loan.getCategory()) {
                case GROUP:
                    validateGroup(loan, errors);
                    break;
                case INDIVIDUAL:
                    validateIndividual(loan, errors);
                    break;
                case EXPRESS:
                    validateExpress(loan, errors);
                    break;
                default:
                    throw new IllegalStateException("Unhandled loan category: " + loan.getCategory());
            }
        }

        if (!errors.isEmpty()) {
            throw new LoanValidationException(errors);
        }
    }

    private void validateGroup(LoanEntity loan, Map<String, String> errors) {
        if (loan.getGroupId() == null) {
            errors.put("groupId", "Group is required for group loans");
        }
        if (loan.getClientIds() == null || loan.getClientIds().isEmpty()) {
            errors.put("clientIds", "At least one client is required for group loans");
        }
        if (loan.getClientId() != null) {
            errors.put("clientId", "Group loans must not reference a single client");
        }
        requirePaymentPlan(loan, errors);
    }

    private void validateIndividual(LoanEntity loan, Map<String, String> errors) {
        if (loan.getClientId() == null) {
            errors.put("clientId", "Client is required for individual loans");
        }
        // guarantors are optional for group member loans
        if (loan.getGroupId() == null && countGuarantors(loan) < 1) {
            errors.put("guarantors", "At least one guarantor is required for individual loans");
        }
        requirePaymentPlan(loan, errors);
    }

    private void validateExpress(LoanEntity loan, Map<String, String> errors) {
        if (loan.getGroupId() != null || (loan.getClientIds() != null && !loan.getClientIds().isEmpty())) {
            errors.put("groupId", "Express loans are not tied to a group");
        }
        if (loan.getLoanDurationUnit() != DurationUnit.MONTHS
                || loan.getLoanDurationNumber() == null
                || loan.getLoanDurationNumber() != EXPRESS_DURATION_MONTHS) {
            errors.put("loanDurationNumber", "Express loans run for exactly one month");
        }
    }

    private void requirePaymentPlan(LoanEntity loan, Map<String, String> errors) {
        if (loan.getPaymentPlan() == null) {
            errors.put("paymentPlan", "paymentPlan is required for group and individual loans");
        }
    }

    private int countGuarantors(LoanEntity loan) {
        if (loan.getGuarantors() == null) {
            return 0;
        }
        int count = 0;
        for (Signatory guarantor : loan.getGuarantors()) {
            if (guarantor != null && !isBlank(guarantor.getName())) {
                count++;
            }
        }
        return count;
    }

    private static void clearClientIds(LoanEntity loan) {
        if (loan.getClientIds() == null) {
            loan.setClientIds(new ArrayList<>());
        } else {
            loan.getClientIds().clear();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
