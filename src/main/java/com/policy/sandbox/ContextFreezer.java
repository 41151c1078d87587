package com.policy.sandbox;

import com.policy.context.DefaultEvaluationContext;
import com.policy.context.EvaluationContext;
import com.policy.context.UserInfo;
import com.policy.expression.ImmutableValues;

/**
 * Deep, structural copy of a context into unmodifiable collections.
 * The caller's maps and lists are never handed to an operation.
 */
final class ContextFreezer {

    private ContextFreezer() {
    }

    static EvaluationContext freeze(EvaluationContext context) {
        if (context == null) {
            return EvaluationContext.builder().build();
        }
        return new DefaultEvaluationContext(
                ImmutableValues.copyOfMap(context.getData()),
                freeze(context.getUser()),
                ImmutableValues.copyOfMap(context.getParams()),
                ImmutableValues.copyOfMap(context.getGlobals()));
    }

    private static UserInfo freeze(UserInfo user) {
        if (user == null) {
            return UserInfo.anonymous();
        }
        return new UserInfo(
                user.id(),
                user.roles(),
                user.permissions(),
                ImmutableValues.copyOfMap(user.attributes()));
    }
}
