package com.policy.config;

import com.policy.policy.PolicySet;
import com.policy.sandbox.EvaluationBudget;

/**
 * A loaded policy document.
 *
 * @param name      Document name
 * @param version   Document version
 * @param policySet Parsed rules
 * @param budget    Sandbox budget for evaluating them
 */
public record PolicyConfig(
        String name,
        String version,
        PolicySet policySet,
        EvaluationBudget budget
) {
}
