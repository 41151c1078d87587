package com.policy.expression;

import com.policy.context.DefaultFieldResolver;
import com.policy.context.EvaluationContext;
import com.policy.context.FieldResolver;
import com.policy.exception.EvaluationException;
import com.policy.exception.PolicyException;
import com.policy.exception.RecursionExceededException;
import com.policy.operation.OperationFunction;
import com.policy.operation.OperationRegistry;
import com.policy.operation.PermissionCheck;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tree-walking interpreter for policy expressions.
 * <p>
 * Dispatch is an exhaustive switch over {@link ExpressionKind}:
 * <ul>
 *   <li>Literal: value verbatim</li>
 *   <li>FieldAccess: path walk through the context, missing = null</li>
 *   <li>Operation: arguments evaluated eagerly left to right, then the registry function</li>
 *   <li>Condition: both sides, then the registered comparator of the same name</li>
 *   <li>Permission: registry permission check with literal arguments and the context</li>
 * </ul>
 * Not thread-safe: the depth counter is per instance. Use one evaluator per
 * evaluation call or per worker thread.
 */
public class ExpressionEvaluator {

    public static final int DEFAULT_MAX_DEPTH = 50;

    private final OperationRegistry registry;
    private final FieldResolver fieldResolver;
    private final NodeGuard guard;
    private final int maxDepth;

    private int currentDepth;

    public ExpressionEvaluator() {
        this(OperationRegistry.defaults(), DEFAULT_MAX_DEPTH);
    }

    public ExpressionEvaluator(OperationRegistry registry, int maxDepth) {
        this(registry, maxDepth, NodeGuard.NONE);
    }

    public ExpressionEvaluator(OperationRegistry registry, int maxDepth, NodeGuard guard) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.registry = registry;
        this.fieldResolver = new DefaultFieldResolver();
        this.guard = guard;
        this.maxDepth = maxDepth;
    }

    /**
     * Evaluate an expression against a context.
     *
     * @param expr    Expression tree
     * @param context Evaluation context
     * @return Result value (may be null)
     * @throws RecursionExceededException if the tree is deeper than the configured maximum
     * @throws EvaluationException        on unknown operations, malformed nodes or a failing operation
     */
    public Object evaluate(Expression expr, EvaluationContext context) {
        currentDepth++;
        if (currentDepth > maxDepth) {
            currentDepth = 0;
            throw new RecursionExceededException(maxDepth);
        }

        try {
            if (expr == null) {
                throw new EvaluationException("Malformed expression: null node");
            }
            guard.beforeVisit(expr);

            Object result = switch (expr.kind()) {
                case LITERAL -> ((Expression.Literal) expr).value();
                case FIELD -> evaluateFieldAccess((Expression.FieldAccess) expr, context);
                case OPERATION -> evaluateOperation((Expression.Operation) expr, context);
                case CONDITION -> evaluateCondition((Expression.Condition) expr, context);
                case PERMISSION -> evaluatePermission((Expression.Permission) expr, context);
            };

            currentDepth--;
            return result;
        } catch (RuntimeException e) {
            // a failed call must not leave the counter dirty for the next one
            currentDepth = 0;
            throw e;
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private Object evaluateFieldAccess(Expression.FieldAccess expr, EvaluationContext context) {
        return fieldResolver.resolve(expr.path(), context).orElse(null);
    }

    private Object evaluateOperation(Expression.Operation expr, EvaluationContext context) {
        String name = expr.name();
        Optional<PermissionCheck> permissionCheck = registry.permissionCheck(name);
        Optional<OperationFunction> operation = registry.operation(name);
        if (permissionCheck.isEmpty() && operation.isEmpty()) {
            throw new EvaluationException("Unknown operation: " + name);
        }

        List<Object> args = evaluateArgs(expr.args(), context);

        if (permissionCheck.isPresent()) {
            return invoke(name, () -> permissionCheck.get().check(args, context));
        }
        return invoke(name, () -> operation.get().apply(args));
    }

    private List<Object> evaluateArgs(List<Expression> argExprs, EvaluationContext context) {
        List<Object> args = new ArrayList<>(argExprs.size());
        for (Expression arg : argExprs) {
            args.add(evaluate(arg, context));
        }
        return Collections.unmodifiableList(args);
    }

    private Object evaluateCondition(Expression.Condition expr, EvaluationContext context) {
        String op = expr.op();
        if (!OperationRegistry.CONDITION_OPERATORS.contains(op)) {
            throw new EvaluationException("Unknown condition operator: " + op);
        }
        OperationFunction comparator = registry.operation(op)
                .orElseThrow(() -> new EvaluationException("Unknown condition operator: " + op));

        Object left = evaluate(expr.left(), context);
        Object right = evaluate(expr.right(), context);
        List<Object> operands = Collections.unmodifiableList(Arrays.asList(left, right));
        return invoke(op, () -> comparator.apply(operands));
    }

    private Object evaluatePermission(Expression.Permission expr, EvaluationContext context) {
        PermissionCheck check = registry.permissionCheck(expr.check())
                .orElseThrow(() -> new EvaluationException("Unknown permission check: " + expr.check()));
        List<Object> args = new ArrayList<>(expr.args());
        return invoke(expr.check(), () -> check.check(args, context));
    }

    /**
     * Registry functions, custom ones included, may fail with any runtime
     * exception. Everything outside the policy hierarchy becomes an
     * {@link EvaluationException}.
     */
    private static Object invoke(String name, Supplier<Object> call) {
        try {
            return call.get();
        } catch (PolicyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Operation '" + name + "' failed: " + e.getMessage(), e);
        }
    }
}
