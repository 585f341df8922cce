package com.fieldops.security;

import java.util.EnumSet;
import java.util.Set;

/**
 * Least-privilege database principals a transaction may switch to.
 *
 * <p>The role names are part of the schema: they are created by the isolation migrations and
 * referenced by every row policy. Renaming one here without a migration breaks context
 * establishment at the store.
 */
public enum DatabaseRole {

    WEB("ops_web"),
    STUDIO("ops_studio"),
    PORTAL("ops_portal"),
    WORKER("ops_worker"),
    SERVICE("ops_service");

    private final String roleName;

    DatabaseRole(String roleName) {
        this.roleName = roleName;
    }

    /** The principal name as known to the store (e.g., "ops_portal"). */
    public String roleName() {
        return roleName;
    }

    /**
     * Whether row policies govern this role. {@link #SERVICE} is administrative and bypasses row
     * security altogether.
     */
    public boolean isPolicyGoverned() {
        return this != SERVICE;
    }

    /** The roles that every protected table must declare a policy shape for. */
    public static Set<DatabaseRole> policyGoverned() {
        return EnumSet.of(WEB, STUDIO, PORTAL, WORKER);
    }
}
