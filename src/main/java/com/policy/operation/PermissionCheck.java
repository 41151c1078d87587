package com.policy.operation;

import com.policy.context.EvaluationContext;

import java.util.List;

/**
 * Permission-flavored operation: a pure function of its arguments and the
 * (read-only) evaluation context.
 */
@FunctionalInterface
public interface PermissionCheck {

    boolean check(List<Object> args, EvaluationContext context);
}
