package com.microfinance.exception;

/**
 * Exception thrown when the caller's role does not permit the operation
 */
public class ForbiddenOperationException extends LoanServiceException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
