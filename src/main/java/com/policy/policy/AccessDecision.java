package com.policy.policy;

import com.policy.field.AllowedFields;
import com.policy.rowfilter.RowFilter;

/**
 * Outcome of an access check.
 */
public interface AccessDecision {

    boolean isAllowed();

    /**
     * Human-readable reason, for logs only.
     */
    String getReason();

    /**
     * Row filter implied by the granting rule; {@link RowFilter#never()} when denied.
     */
    RowFilter getRowFilter();

    /**
     * Readable and writable fields granted; none when denied.
     */
    AllowedFields getAllowedFields();
}
