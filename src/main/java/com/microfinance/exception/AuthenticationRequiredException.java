package com.microfinance.exception;

/**
 * Exception thrown when an operation needs an identified caller and none was resolved
 */
public class AuthenticationRequiredException extends LoanServiceException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
