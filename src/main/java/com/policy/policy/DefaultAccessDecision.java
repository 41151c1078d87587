package com.policy.policy;

import com.policy.field.AllowedFields;
import com.policy.rowfilter.RowFilter;

/**
 * Default implementation of AccessDecision.
 * Every denial, whatever its cause, is the same {@link #denied()} instance.
 */
public final class DefaultAccessDecision implements AccessDecision {

    private static final AccessDecision DENIED =
            new DefaultAccessDecision(false, "Access denied", RowFilter.never(), AllowedFields.none());

    private final boolean allowed;
    private final String reason;
    private final RowFilter rowFilter;
    private final AllowedFields allowedFields;

    private DefaultAccessDecision(boolean allowed, String reason, RowFilter rowFilter, AllowedFields allowedFields) {
        this.allowed = allowed;
        this.reason = reason;
        this.rowFilter = rowFilter;
        this.allowedFields = allowedFields;
    }

    @Override
    public boolean isAllowed() {
        return allowed;
    }

    @Override
    public String getReason() {
        return reason;
    }

    @Override
    public RowFilter getRowFilter() {
        return rowFilter;
    }

    @Override
    public AllowedFields getAllowedFields() {
        return allowedFields;
    }

    @Override
    public String toString() {
        return "AccessDecision{" +
                "allowed=" + allowed +
                ", reason='" + reason + '\'' +
                ", rowFilter=" + rowFilter.toMap() +
                ", fields=" + allowedFields +
                '}';
    }

    /**
     * Create a decision granting access under the given rule.
     */
    public static AccessDecision allowed(PolicyRule rule, RowFilter rowFilter, AllowedFields allowedFields) {
        return new DefaultAccessDecision(true, "Allowed by " + rule, rowFilter, allowedFields);
    }

    /**
     * The canonical denial: no policy, evaluation error and a false allow
     * condition all resolve here.
     */
    public static AccessDecision denied() {
        return DENIED;
    }
}
