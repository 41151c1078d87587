package com.policy.sandbox;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Limits applied to one sandboxed evaluation.
 *
 * @param maxDepth          Maximum nesting depth of the expression tree
 * @param maxOperations     Maximum number of visited nodes
 * @param timeoutMs         Wall-clock limit, checked at every node visit
 * @param allowedOperations Names allowed to run; null means every registered operation
 */
public record EvaluationBudget(
        int maxDepth,
        int maxOperations,
        long timeoutMs,
        Set<String> allowedOperations
) {
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_OPERATIONS = 100;
    public static final long DEFAULT_TIMEOUT_MS = 100;

    public EvaluationBudget {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxOperations < 1) {
            throw new IllegalArgumentException("maxOperations must be positive: " + maxOperations);
        }
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        allowedOperations = allowedOperations == null
                ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedOperations));
    }

    public static EvaluationBudget defaults() {
        return new EvaluationBudget(DEFAULT_MAX_DEPTH, DEFAULT_MAX_OPERATIONS, DEFAULT_TIMEOUT_MS, null);
    }

    /**
     * Whether the named operation may run under this budget.
     */
    public boolean isAllowed(String name) {
        return allowedOperations == null || allowedOperations.contains(name);
    }

    public EvaluationBudget withMaxDepth(int maxDepth) {
        return new EvaluationBudget(maxDepth, maxOperations, timeoutMs, allowedOperations);
    }

    public EvaluationBudget withMaxOperations(int maxOperations) {
        return new EvaluationBudget(maxDepth, maxOperations, timeoutMs, allowedOperations);
    }

    public EvaluationBudget withTimeoutMs(long timeoutMs) {
        return new EvaluationBudget(maxDepth, maxOperations, timeoutMs, allowedOperations);
    }

    public EvaluationBudget withAllowedOperations(Set<String> allowedOperations) {
        return new EvaluationBudget(maxDepth, maxOperations, timeoutMs, allowedOperations);
    }
}
