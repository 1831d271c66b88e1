package com.microfinance.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exception thrown when a mutation is rejected by validation. Carries one message per offending field.
 */
public class LoanValidationException extends LoanServiceException {

    private final Map<String, String> fieldErrors;

    public LoanValidationException(String message) {
        super(message);
        this.fieldErrors = Collections.emptyMap();
    }

    public LoanValidationException(Map<String, String> fieldErrors) {
        super(describe(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    private static String describe(Map<String, String> fieldErrors) {
        return "Loan validation failed: " + fieldErrors.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
