package com.policy.exception;

/**
 * Raised by the evaluator when the expression tree is nested deeper than the
 * configured maximum depth.
 */
public class RecursionExceededException extends BudgetExceededException {

    private final int maxDepth;

    public RecursionExceededException(int maxDepth) {
        super("Maximum recursion depth (" + maxDepth + ") exceeded");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
