package com.policy.sandbox;

import com.policy.context.EvaluationContext;
import com.policy.exception.BudgetExceededException;
import com.policy.exception.EvaluationException;
import com.policy.exception.ExpressionSecurityException;
import com.policy.expression.Expression;
import com.policy.expression.ExpressionEvaluator;
import com.policy.expression.NodeGuard;
import com.policy.operation.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Sandboxed evaluation of untrusted expressions.
 * <p>
 * Each call:
 * <ol>
 *   <li>validates the tree statically (denylisted path segments, allow-list)</li>
 *   <li>deep-copies the context into unmodifiable structures</li>
 *   <li>evaluates with a fresh evaluator whose node hook enforces the operation
 *       count and the timeout at every visited node</li>
 * </ol>
 * The result either equals the unguarded result or the call raises
 * {@link ExpressionSecurityException} / {@link BudgetExceededException}.
 * Per-call state lives in the call, so one instance may be shared.
 */
public class SafeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SafeEvaluator.class);

    private final EvaluationBudget budget;
    private final OperationRegistry registry;

    public SafeEvaluator() {
        this(EvaluationBudget.defaults());
    }

    public SafeEvaluator(EvaluationBudget budget) {
        this(budget, OperationRegistry.defaults());
    }

    public SafeEvaluator(EvaluationBudget budget, OperationRegistry registry) {
        this.budget = budget;
        this.registry = registry;
    }

    /**
     * Evaluate an expression inside the sandbox.
     *
     * @throws ExpressionSecurityException on a denylisted path or a disallowed operation
     * @throws BudgetExceededException     on depth, operation count or timeout overage
     * @throws EvaluationException         on a malformed expression or a failing operation
     */
    public Object evaluate(Expression expr, EvaluationContext context) {
        PathValidator.validate(expr, budget);
        EvaluationContext frozen = ContextFreezer.freeze(context);

        BudgetGuard guard = new BudgetGuard(budget);
        ExpressionEvaluator evaluator = new ExpressionEvaluator(registry, budget.maxDepth(), guard);
        Object result = evaluator.evaluate(expr, frozen);

        log.debug("Sandboxed evaluation finished: {} nodes in {}ms", guard.operations, guard.elapsedMs());
        return result;
    }

    /**
     * Evaluate for non-security computed values: a plain evaluation error is
     * logged and replaced by null. Security and budget violations still propagate.
     */
    public Object evaluateOrNull(Expression expr, EvaluationContext context) {
        try {
            return evaluate(expr, context);
        } catch (EvaluationException e) {
            log.warn("Evaluation of {} failed, using null: {}", expr, e.getMessage());
            return null;
        }
    }

    /**
     * Counts visited nodes and watches the clock for one evaluation.
     */
    private static final class BudgetGuard implements NodeGuard {
        private final EvaluationBudget budget;
        private final long startNanos = System.nanoTime();
        private int operations;

        BudgetGuard(EvaluationBudget budget) {
            this.budget = budget;
        }

        @Override
        public void beforeVisit(Expression node) {
            operations++;
            if (operations > budget.maxOperations()) {
                throw new BudgetExceededException(
                        "Maximum operations (" + budget.maxOperations() + ") exceeded");
            }
            if (elapsedMs() > budget.timeoutMs()) {
                throw new BudgetExceededException(
                        "Evaluation timeout (" + budget.timeoutMs() + "ms) exceeded");
            }
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
