package com.policy.exception;

/**
 * Raised when an expression tries to reach a denylisted property or run an
 * operation outside the configured allow-list. Terminal: never defaulted.
 */
public class ExpressionSecurityException extends PolicyException {

    public ExpressionSecurityException(String message) {
        super(message);
    }
}
