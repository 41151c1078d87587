package com.policy.policy;

import com.policy.context.UserInfo;
import com.policy.field.AllowedFields;
import com.policy.rowfilter.RowFilter;

import java.util.Map;

/**
 * Binds policy rules to (resource, action) and answers access questions.
 * Fail-closed: a missing policy or an evaluation error is a denial.
 */
public interface PolicyEngine {

    /**
     * Full decision: allowed flag, row filter and field lists.
     *
     * @param request Access request
     * @return Decision; {@link DefaultAccessDecision#denied()} unless a rule grants
     */
    AccessDecision evaluate(AccessRequest request);

    /**
     * Whether the request is allowed.
     */
    boolean checkAccess(AccessRequest request);

    /**
     * Row filter for a query on {@code resource}, ANDed with the caller's own where clause.
     *
     * @param resource Resource name
     * @param action   Action
     * @param user     Acting user
     * @param where    Caller's where clause in {@link RowFilter#toMap()} shape; may be null
     * @return Filter; {@link RowFilter#never()} when no policy exists
     */
    RowFilter applyRowFilters(String resource, Action action, UserInfo user, Map<String, ?> where);

    /**
     * Readable and writable fields; none when no policy exists.
     */
    AllowedFields getAllowedFields(String resource, Action action, UserInfo user);

    /**
     * Current policy set.
     */
    PolicySet getPolicySet();

    /**
     * Replace the whole policy set atomically.
     */
    void reload(PolicySet policySet);
}
