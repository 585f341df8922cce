package com.fieldops.database.policy;

import com.fieldops.security.DatabaseRole;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application-side mirror of the row policies installed by the isolation migrations.
 *
 * <p>The store is the authority: policies are enforced there whether or not this class exists.
 * The catalog lets tests and the start-up inspector state what the store is supposed to contain
 * and detect when the two disagree.
 *
 * <h2>Design rules ({@link #validate()})</h2>
 *
 * <ul>
 *   <li>every table declares a shape for each policy-governed role and none for the service role
 *   <li>internal roles always get tenant-match
 *   <li>tenant-scoped and internal-only tables deny the portal role outright
 *   <li>portal-owned tables give the portal role owner-match on a declared owner column
 * </ul>
 */
public final class RowPolicyCatalog {

    private static final RowPolicyCatalog STANDARD = new RowPolicyCatalog(List.of(
            ProtectedTable.tenantScoped("tenants", "id"),
            ProtectedTable.portalOwned("work_orders", "portal_user_id"),
            ProtectedTable.tenantScoped("assignments", "tenant_id"),
            ProtectedTable.tenantScoped("invoices", "tenant_id"),
            ProtectedTable.tenantScoped("notification_outbox", "tenant_id"),
            ProtectedTable.portalOwned("documents", "owner_user_id"),
            ProtectedTable.portalOwned("channel_requests", "requested_by_user_id"),
            ProtectedTable.internalOnly("employees")));

    private final Map<String, ProtectedTable> tables;

    public RowPolicyCatalog(List<ProtectedTable> tables) {
        Map<String, ProtectedTable> byName = new LinkedHashMap<>();
        for (ProtectedTable table : tables) {
            if (byName.putIfAbsent(table.name(), table) != null) {
                throw new IllegalArgumentException("table declared twice: " + table.name());
            }
        }
        this.tables = byName;
    }

    /** The tables protected by the bundled migrations. */
    public static RowPolicyCatalog standard() {
        return STANDARD;
    }

    public List<ProtectedTable> tables() {
        return List.copyOf(tables.values());
    }

    public Optional<ProtectedTable> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public List<ProtectedTable> tablesOf(TableClass tableClass) {
        return tables.values().stream().filter(t -> t.tableClass() == tableClass).toList();
    }

    /** Checks every table against the design rules. */
    public PolicyDriftReport validate() {
        List<String> errors = new ArrayList<>();
        for (ProtectedTable table : tables.values()) {
            if (table.policies().containsKey(DatabaseRole.SERVICE)) {
                errors.add(table.name() + ": the service role must not be policy-governed");
            }
            for (DatabaseRole role : DatabaseRole.policyGoverned()) {
                Optional<PolicyShape> shape = table.shapeFor(role);
                if (shape.isEmpty()) {
                    errors.add(table.name() + ": no policy shape for " + role.roleName());
                } else if (role != DatabaseRole.PORTAL && shape.get() != PolicyShape.TENANT_MATCH) {
                    errors.add(table.name() + ": " + role.roleName() + " must use TENANT_MATCH, not "
                            + shape.get());
                }
            }
            PolicyShape portal = table.policies().get(DatabaseRole.PORTAL);
            switch (table.tableClass()) {
                case TENANT_SCOPED, INTERNAL_ONLY -> {
                    if (portal != null && portal != PolicyShape.DENY_ALL) {
                        errors.add(table.name() + ": " + table.tableClass()
                                + " table must deny the portal role, not " + portal);
                    }
                }
                case PORTAL_OWNED -> {
                    if (portal != null && portal != PolicyShape.OWNER_MATCH) {
                        errors.add(table.name() + ": portal-owned table must use OWNER_MATCH for "
                                + "the portal role, not " + portal);
                    }
                    if (table.ownerColumn() == null || table.ownerColumn().isBlank()) {
                        errors.add(table.name() + ": portal-owned table has no owner column");
                    }
                }
            }
        }
        return PolicyDriftReport.of(errors);
    }
}
