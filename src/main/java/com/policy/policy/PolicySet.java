package com.policy.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of policy rules indexed by (resource, action).
 * Rules sharing a key keep their declaration order.
 */
public final class PolicySet {

    private static final PolicySet EMPTY = new PolicySet(List.of());

    private final List<PolicyRule> rules;
    private final Map<RuleKey, List<PolicyRule>> index;

    private PolicySet(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
        Map<RuleKey, List<PolicyRule>> byKey = new LinkedHashMap<>();
        for (PolicyRule rule : this.rules) {
            byKey.computeIfAbsent(new RuleKey(rule.resource(), rule.action()), k -> new ArrayList<>()).add(rule);
        }
        byKey.replaceAll((k, v) -> List.copyOf(v));
        this.index = Collections.unmodifiableMap(byKey);
    }

    public static PolicySet empty() {
        return EMPTY;
    }

    public static PolicySet of(PolicyRule... rules) {
        return of(List.of(rules));
    }

    public static PolicySet of(List<PolicyRule> rules) {
        return rules.isEmpty() ? EMPTY : new PolicySet(rules);
    }

    /**
     * Rules for an exact (resource, action) match; empty if none.
     */
    public List<PolicyRule> rulesFor(String resource, Action action) {
        return index.getOrDefault(new RuleKey(resource, action), List.of());
    }

    public boolean hasPolicy(String resource, Action action) {
        return index.containsKey(new RuleKey(resource, action));
    }

    public List<PolicyRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "PolicySet{rules=" + rules.size() + ", keys=" + index.keySet() + '}';
    }

    private record RuleKey(String resource, Action action) {
        @Override
        public String toString() {
            return resource + ":" + action;
        }
    }
}
