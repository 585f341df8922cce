package com.fieldops.database.policy;

import com.fieldops.database.isolation.SessionVariable;
import java.util.Optional;

/**
 * The three admissible row-policy predicates. Every shape is fail-closed: when its governing
 * session variable is absent, empty or not a UUID, the predicate is false.
 */
public enum PolicyShape {

    /** Row's tenant column equals {@code app.tenant_id}. */
    TENANT_MATCH(SessionVariable.TENANT_ID),

    /** Row's owner column equals {@code app.user_id}, inside an external-lane tenant. */
    OWNER_MATCH(SessionVariable.USER_ID),

    /** No rows, regardless of context. */
    DENY_ALL(null);

    private final SessionVariable governingVariable;

    PolicyShape(SessionVariable governingVariable) {
        this.governingVariable = governingVariable;
    }

    /** The variable the predicate reads; empty for {@link #DENY_ALL}. */
    public Optional<SessionVariable> governingVariable() {
        return Optional.ofNullable(governingVariable);
    }
}
