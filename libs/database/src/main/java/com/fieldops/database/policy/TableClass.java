package com.fieldops.database.policy;

/** Classification of a protected table, which fixes the policy shape per role. */
public enum TableClass {

    /** Tenant-match for internal audiences, deny-all for the portal. */
    TENANT_SCOPED,

    /** Tenant-match for internal audiences, owner-match for the portal. */
    PORTAL_OWNED,

    /** Staff-only data such as the employee roster: tenant-match internally, deny-all for the portal. */
    INTERNAL_ONLY
}
