package com.policy.operation;

import java.util.List;

/**
 * Pure function of already-evaluated arguments.
 */
@FunctionalInterface
public interface OperationFunction {

    /**
     * @param args Evaluated arguments, left to right (may contain nulls)
     * @return Result value (may be null)
     */
    Object apply(List<Object> args);
}
