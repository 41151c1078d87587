package com.policy.policy;

import com.policy.expression.Expression;
import com.policy.field.FieldSpec;

import java.util.Objects;

/**
 * One rule: who may perform {@code action} on {@code resource}, and which
 * fields they see.
 *
 * @param resource Resource (model) name
 * @param action   Governed action
 * @param allow    Boolean allow expression
 * @param fields   Field lists; unrestricted when omitted
 */
public record PolicyRule(String resource, Action action, Expression allow, FieldSpec fields) {

    public PolicyRule {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Policy resource cannot be blank");
        }
        Objects.requireNonNull(action, "Policy action cannot be null");
        Objects.requireNonNull(allow, "Policy allow expression cannot be null");
        fields = fields != null ? fields : FieldSpec.unrestricted();
    }

    public PolicyRule(String resource, Action action, Expression allow) {
        this(resource, action, allow, null);
    }

    @Override
    public String toString() {
        return resource + ":" + action + " allow " + allow;
    }
}
