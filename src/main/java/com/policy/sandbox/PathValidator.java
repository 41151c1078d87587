package com.policy.sandbox;

import com.policy.exception.ExpressionSecurityException;
import com.policy.expression.Expression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Static pre-evaluation check of an expression tree.
 * Rejects field paths reaching host internals and, when an allow-list is
 * configured, any operation, comparator or permission check outside it.
 * <p>
 * Walks the tree iteratively, so an over-deep tree is still fully validated
 * and the depth limit is left to the evaluator.
 */
final class PathValidator {

    static final Set<String> DENIED_SEGMENTS = Set.of(
            "__proto__", "constructor", "prototype",
            "process", "global", "globalThis",
            "require", "module", "exports",
            "eval", "Function",
            "__dirname", "__filename",
            "class", "getClass", "classLoader"
    );

    private PathValidator() {
    }

    static void validate(Expression root, EvaluationBudget budget) {
        Deque<Expression> pending = new ArrayDeque<>();
        if (root != null) {
            pending.push(root);
        }

        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            switch (node.kind()) {
                case LITERAL -> {
                }
                case FIELD -> checkPath(((Expression.FieldAccess) node).path());
                case OPERATION -> {
                    Expression.Operation operation = (Expression.Operation) node;
                    checkAllowed(operation.name(), budget);
                    operation.args().forEach(pending::push);
                }
                case CONDITION -> {
                    Expression.Condition condition = (Expression.Condition) node;
                    checkAllowed(condition.op(), budget);
                    pending.push(condition.right());
                    pending.push(condition.left());
                }
                case PERMISSION -> checkAllowed(((Expression.Permission) node).check(), budget);
            }
        }
    }

    private static void checkPath(String path) {
        for (String segment : path.split("\\.")) {
            if (DENIED_SEGMENTS.contains(segment)) {
                throw new ExpressionSecurityException(
                        "Access to '" + segment + "' is not allowed in path '" + path + "'");
            }
        }
    }

    private static void checkAllowed(String name, EvaluationBudget budget) {
        if (!budget.isAllowed(name)) {
            throw new ExpressionSecurityException("Operation '" + name + "' is not allowed");
        }
    }
}
