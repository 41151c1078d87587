package com.policy.exception;

/**
 * Plain evaluation failure: unknown operation or comparator, malformed node,
 * wildcard on a non-array value, bad operation arguments.
 * <p>
 * Indicates a malformed policy. The access-check path treats it as a denial.
 */
public class EvaluationException extends PolicyException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
