package com.policy.policy;

import com.policy.context.EvaluationContext;
import com.policy.context.UserInfo;
import com.policy.exception.EvaluationException;
import com.policy.expression.Truthiness;
import com.policy.field.AllowedFields;
import com.policy.field.FieldFilter;
import com.policy.operation.OperationRegistry;
import com.policy.rowfilter.RowFilter;
import com.policy.rowfilter.RowFilterExtractor;
import com.policy.sandbox.EvaluationBudget;
import com.policy.sandbox.SafeEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PolicyEngine over an immutable {@link PolicySet}.
 * <p>
 * Allow expressions run in a {@link SafeEvaluator}; row filters come from a
 * separate, non-evaluating {@link RowFilterExtractor} pass over the same tree.
 * When several rules share a (resource, action), any allowing rule grants and
 * the first one that does supplies the row filter and fields.
 * <p>
 * Thread-safe. {@link #reload(PolicySet)} swaps the set atomically, so an
 * in-flight call sees exactly one version.
 */
public class DefaultPolicyEngine implements PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPolicyEngine.class);

    static final String GLOBAL_RESOURCE = "resource";
    static final String GLOBAL_ACTION = "action";
    static final String GLOBAL_WHERE = "where";

    private final AtomicReference<PolicySet> policySet;
    private final SafeEvaluator evaluator;
    private final RowFilterExtractor extractor;

    public DefaultPolicyEngine(PolicySet policySet) {
        this(policySet, EvaluationBudget.defaults(), OperationRegistry.defaults());
    }

    public DefaultPolicyEngine(PolicySet policySet, EvaluationBudget budget, OperationRegistry registry) {
        this.policySet = new AtomicReference<>(policySet != null ? policySet : PolicySet.empty());
        this.evaluator = new SafeEvaluator(budget, registry);
        this.extractor = new RowFilterExtractor();

        log.info("DefaultPolicyEngine initialized with {} rules", this.policySet.get().size());
    }

    @Override
    public AccessDecision evaluate(AccessRequest request) {
        List<PolicyRule> rules = policySet.get().rulesFor(request.resource(), request.action());
        if (rules.isEmpty()) {
            log.debug("No policy for {}:{}, denying", request.resource(), request.action());
            return DefaultAccessDecision.denied();
        }

        EvaluationContext context = EvaluationContext.builder()
                .data(request.data())
                .user(request.user())
                .params(request.params())
                .global(GLOBAL_RESOURCE, request.resource())
                .global(GLOBAL_ACTION, request.action().getValue())
                .build();

        for (PolicyRule rule : rules) {
            if (allows(rule, context)) {
                AccessDecision decision = DefaultAccessDecision.allowed(
                        rule,
                        extractor.extract(rule.allow(), context),
                        FieldFilter.filterFields(rule.fields(), context));
                log.debug("{}:{} allowed for user {}", request.resource(), request.action(), request.user().id());
                return decision;
            }
        }

        log.debug("{}:{} denied for user {}", request.resource(), request.action(), request.user().id());
        return DefaultAccessDecision.denied();
    }

    @Override
    public boolean checkAccess(AccessRequest request) {
        return evaluate(request).isAllowed();
    }

    @Override
    public RowFilter applyRowFilters(String resource, Action action, UserInfo user, Map<String, ?> where) {
        List<PolicyRule> rules = policySet.get().rulesFor(resource, action);
        if (rules.isEmpty()) {
            log.debug("No policy for {}:{}, row filter matches nothing", resource, action);
            return RowFilter.never();
        }

        EvaluationContext context = EvaluationContext.builder()
                .user(user)
                .global(GLOBAL_RESOURCE, resource)
                .global(GLOBAL_ACTION, action.getValue())
                .global(GLOBAL_WHERE, where != null ? where : Map.of())
                .build();

        // a row is visible if any rule could allow it
        List<RowFilter> perRule = new ArrayList<>(rules.size());
        for (PolicyRule rule : rules) {
            perRule.add(extractor.extract(rule.allow(), context));
        }
        RowFilter filter = RowFilter.or(perRule);
        if (filter.isUnrestricted()) {
            log.debug("Row filter for {}:{} is unrestricted", resource, action);
        }
        return RowFilter.and(filter, RowFilter.fromMap(where));
    }

    @Override
    public AllowedFields getAllowedFields(String resource, Action action, UserInfo user) {
        List<PolicyRule> rules = policySet.get().rulesFor(resource, action);
        if (rules.isEmpty()) {
            return AllowedFields.none();
        }
        EvaluationContext context = EvaluationContext.builder().user(user).build();
        return FieldFilter.filterFields(rules.get(0).fields(), context);
    }

    @Override
    public PolicySet getPolicySet() {
        return policySet.get();
    }

    @Override
    public void reload(PolicySet newPolicySet) {
        PolicySet next = newPolicySet != null ? newPolicySet : PolicySet.empty();
        PolicySet previous = policySet.getAndSet(next);
        log.info("Policy set reloaded: {} rules (was {})", next.size(), previous.size());
    }

    /**
     * Evaluate one rule. A plain evaluation error means this rule does not
     * grant; security and budget violations propagate.
     */
    private boolean allows(PolicyRule rule, EvaluationContext context) {
        try {
            return Truthiness.isTruthy(evaluator.evaluate(rule.allow(), context));
        } catch (EvaluationException e) {
            log.warn("Policy {} failed to evaluate, treating as denied: {}", rule, e.getMessage());
            return false;
        }
    }
}
