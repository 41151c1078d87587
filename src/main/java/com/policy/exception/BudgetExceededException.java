package com.policy.exception;

/**
 * Raised when an evaluation runs past its operation, time or depth budget.
 * Terminal: no partial result is ever returned alongside it.
 */
public class BudgetExceededException extends PolicyException {

    public BudgetExceededException(String message) {
        super(message);
    }
}
