package com.fieldops.database.policy;

import com.fieldops.security.AudienceRoleMapper;
import com.fieldops.security.DatabaseRole;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A table under row-level security together with the policy shape each governed role gets.
 *
 * @param name unqualified table name in the {@code public} schema
 * @param tableClass classification that determined the shapes
 * @param tenantColumn column compared against {@code app.tenant_id}
 * @param ownerColumn column compared against {@code app.user_id}; null unless portal-owned
 * @param policies shape per policy-governed role
 */
public record ProtectedTable(
        String name,
        TableClass tableClass,
        String tenantColumn,
        String ownerColumn,
        Map<DatabaseRole, PolicyShape> policies) {

    public ProtectedTable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(tableClass, "tableClass must not be null");
        Objects.requireNonNull(tenantColumn, "tenantColumn must not be null");
        policies = policies.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(policies));
    }

    public static ProtectedTable tenantScoped(String name, String tenantColumn) {
        return new ProtectedTable(name, TableClass.TENANT_SCOPED, tenantColumn, null,
                shapes(PolicyShape.DENY_ALL));
    }

    public static ProtectedTable portalOwned(String name, String ownerColumn) {
        return new ProtectedTable(name, TableClass.PORTAL_OWNED, "tenant_id", ownerColumn,
                shapes(PolicyShape.OWNER_MATCH));
    }

    public static ProtectedTable internalOnly(String name) {
        return new ProtectedTable(name, TableClass.INTERNAL_ONLY, "tenant_id", null,
                shapes(PolicyShape.DENY_ALL));
    }

    /** The shape declared for a role, empty when the role has none. */
    public Optional<PolicyShape> shapeFor(DatabaseRole role) {
        return Optional.ofNullable(policies.get(role));
    }

    /**
     * Policy names the migrations create for a role on this table: {@code <table>_<aud>_select}
     * and {@code <table>_<aud>_modify} for predicate shapes, {@code <table>_<aud>_deny} for
     * deny-all.
     */
    public List<String> expectedPolicyNames(DatabaseRole role) {
        PolicyShape shape = policies.get(role);
        if (shape == null) {
            return List.of();
        }
        String prefix = name + "_" + AudienceRoleMapper.audienceFor(role).value();
        List<String> names = new ArrayList<>();
        if (shape == PolicyShape.DENY_ALL) {
            names.add(prefix + "_deny");
        } else {
            names.add(prefix + "_select");
            names.add(prefix + "_modify");
        }
        return List.copyOf(names);
    }

    private static Map<DatabaseRole, PolicyShape> shapes(PolicyShape portalShape) {
        Map<DatabaseRole, PolicyShape> shapes = new EnumMap<>(DatabaseRole.class);
        shapes.put(DatabaseRole.WEB, PolicyShape.TENANT_MATCH);
        shapes.put(DatabaseRole.STUDIO, PolicyShape.TENANT_MATCH);
        shapes.put(DatabaseRole.WORKER, PolicyShape.TENANT_MATCH);
        shapes.put(DatabaseRole.PORTAL, portalShape);
        return shapes;
    }
}
