package com.microfinance.exception;

/**
 * Exception thrown when a referenced loan, group, client or distribution does not exist
 */
public class ResourceNotFoundException extends LoanServiceException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException loan(Object id) {
        return new ResourceNotFoundException("Loan not found: " + id);
    }
}
