package com.policy.expression;

/**
 * Hook invoked by the evaluator on entry to every node, before the node is
 * evaluated. Throwing aborts the whole evaluation.
 */
@FunctionalInterface
public interface NodeGuard {

    NodeGuard NONE = node -> { };

    void beforeVisit(Expression node);
}
