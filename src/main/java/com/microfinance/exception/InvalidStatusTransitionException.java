package com.microfinance.exception;

import com.microfinance.domain.model.LoanStatus;

/**
 * Exception thrown for a lifecycle transition the state machine does not allow
 */
public class InvalidStatusTransitionException extends LoanServiceException {

    public InvalidStatusTransitionException(LoanStatus from, LoanStatus to) {
        super("Cannot change loan status from " + from.getWireName() + " to " + to.getWireName());
    }
}
