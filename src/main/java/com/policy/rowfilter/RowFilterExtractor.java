package com.policy.rowfilter;

import com.policy.context.DefaultFieldResolver;
import com.policy.context.EvaluationContext;
import com.policy.context.FieldResolver;
import com.policy.context.FieldScope;
import com.policy.expression.Expression;
import com.policy.expression.Truthiness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a {@link RowFilter} from an allow expression without evaluating it.
 * <p>
 * Only equality between a record field and a value known before the query
 * runs (a literal, or a {@code user.}, {@code params.} or {@code globals.}
 * field resolved against the context) becomes a predicate. Everything else
 * contributes no constraint, so the filter is never narrower than the access
 * check; the access check stays the authority on every row.
 */
public class RowFilterExtractor {

    private static final Logger log = LoggerFactory.getLogger(RowFilterExtractor.class);

    public static final int DEFAULT_MAX_DEPTH = 32;

    private final FieldResolver fieldResolver = new DefaultFieldResolver();
    private final int maxDepth;

    public RowFilterExtractor() {
        this(DEFAULT_MAX_DEPTH);
    }

    public RowFilterExtractor(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Extract the row filter implied by an expression.
     *
     * @param expr    Allow expression
     * @param context Context supplying the user, params and globals
     * @return Normalized filter; {@link RowFilter#unrestricted()} when nothing reduces
     */
    public RowFilter extract(Expression expr, EvaluationContext context) {
        return extract(expr, context, 0);
    }

    private RowFilter extract(Expression expr, EvaluationContext context, int depth) {
        if (expr == null) {
            return RowFilter.unrestricted();
        }
        if (depth > maxDepth) {
            log.warn("Row filter extraction stopped at depth {}, widening to unrestricted", maxDepth);
            return RowFilter.unrestricted();
        }

        return switch (expr.kind()) {
            case LITERAL -> Truthiness.isTruthy(((Expression.Literal) expr).value())
                    ? RowFilter.unrestricted()
                    : RowFilter.never();
            case CONDITION -> {
                Expression.Condition condition = (Expression.Condition) expr;
                yield "eq".equals(condition.op())
                        ? extractEquality(condition.left(), condition.right(), context)
                        : RowFilter.unrestricted();
            }
            case OPERATION -> extractOperation((Expression.Operation) expr, context, depth);
            case FIELD, PERMISSION -> RowFilter.unrestricted();
        };
    }

    private RowFilter extractOperation(Expression.Operation operation, EvaluationContext context, int depth) {
        switch (operation.name()) {
            case "and":
                return RowFilter.and(extractAll(operation.args(), context, depth));
            case "or":
                return RowFilter.or(extractAll(operation.args(), context, depth));
            case "eq":
                if (operation.args().size() == 2) {
                    return extractEquality(operation.args().get(0), operation.args().get(1), context);
                }
                return RowFilter.unrestricted();
            default:
                log.debug("Operation '{}' has no row filter form, widening", operation.name());
                return RowFilter.unrestricted();
        }
    }

    private List<RowFilter> extractAll(List<Expression> args, EvaluationContext context, int depth) {
        List<RowFilter> filters = new ArrayList<>(args.size());
        for (Expression arg : args) {
            filters.add(extract(arg, context, depth + 1));
        }
        return filters;
    }

    private RowFilter extractEquality(Expression left, Expression right, EvaluationContext context) {
        RowFilter filter = matchFieldAgainst(left, right, context);
        return filter != null ? filter : orUnrestricted(matchFieldAgainst(right, left, context));
    }

    /**
     * Filter for "recordField == value", or null when the pair does not fit that shape.
     */
    private RowFilter matchFieldAgainst(Expression fieldSide, Expression valueSide, EvaluationContext context) {
        if (!(fieldSide instanceof Expression.FieldAccess recordField) || !isRecordField(recordField.path())) {
            return null;
        }
        if (valueSide instanceof Expression.Literal literal) {
            return RowFilter.match(recordField.path(), literal.value());
        }
        if (valueSide instanceof Expression.FieldAccess ambient
                && FieldScope.fromPath(ambient.path()) != FieldScope.DATA
                && !hasWildcard(ambient.path())) {
            Object resolved = fieldResolver.resolve(ambient.path(), context).orElse(null);
            return RowFilter.match(recordField.path(), resolved);
        }
        return null;
    }

    private static boolean isRecordField(String path) {
        return FieldScope.fromPath(path) == FieldScope.DATA && !hasWildcard(path);
    }

    private static boolean hasWildcard(String path) {
        for (String segment : path.split("\\.")) {
            if (FieldResolver.WILDCARD.equals(segment)) {
                return true;
            }
        }
        return false;
    }

    private static RowFilter orUnrestricted(RowFilter filter) {
        return filter != null ? filter : RowFilter.unrestricted();
    }
}
