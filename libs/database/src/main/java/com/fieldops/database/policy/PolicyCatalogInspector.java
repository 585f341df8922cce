package com.fieldops.database.policy;

import com.fieldops.database.isolation.SessionVariable;
import com.fieldops.security.AudienceRoleMapper;
import com.fieldops.security.DatabaseRole;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Compares a {@link RowPolicyCatalog} with the row security actually installed in the store.
 *
 * <p>Reads {@code pg_class} for the enabled and forced flags and {@code pg_policies} for the
 * policies themselves. A finding is reported when a catalogued table is missing or not under
 * forced row security, when a governed role lacks one of its expected policies, when a policy's
 * {@code USING} or {@code WITH CHECK} predicate does not read the expected accessor, or when any
 * other policy could widen what a governed role sees.
 *
 * <p>Policies on a protected table may only target the request roles. A policy granted to any
 * other role, the pool login {@code ops_app} included, is drift: members inherit it, so it would
 * apply to connections that carry no context at all.
 */
public class PolicyCatalogInspector {

    private static final Logger log = LoggerFactory.getLogger(PolicyCatalogInspector.class);

    static final String TABLES_SQL = """
            SELECT c.relname, c.relrowsecurity, c.relforcerowsecurity
              FROM pg_class c
              JOIN pg_namespace n ON n.oid = c.relnamespace
             WHERE n.nspname = 'public' AND c.relkind = 'r'
            """;

    private static final String PUBLIC = "public";
    private static final String SELECT = "SELECT";

    static final String POLICIES_SQL = """
            SELECT tablename, policyname, array_to_string(roles, ',') AS roles, cmd, qual, with_check
              FROM pg_policies
             WHERE schemaname = 'public'
            """;

    /** Row security flags of one table. */
    public record TableSecurity(String table, boolean enabled, boolean forced) {}

    /** One row of {@code pg_policies}. */
    public record LivePolicy(
            String table, String name, Set<String> roles, String command, String using, String withCheck) {

        boolean appliesTo(String roleName) {
            return roles.contains(roleName) || roles.contains(PUBLIC);
        }
    }

    private final JdbcTemplate jdbc;
    private final RowPolicyCatalog catalog;

    public PolicyCatalogInspector(DataSource dataSource, RowPolicyCatalog catalog) {
        this.jdbc = new JdbcTemplate(Objects.requireNonNull(dataSource, "dataSource must not be null"));
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /** Reads the live store and reports drift against the catalog. */
    public PolicyDriftReport inspect() {
        List<TableSecurity> tables = jdbc.query(TABLES_SQL, (rs, i) -> new TableSecurity(
                rs.getString("relname"), rs.getBoolean("relrowsecurity"), rs.getBoolean("relforcerowsecurity")));
        List<LivePolicy> policies = jdbc.query(POLICIES_SQL, (rs, i) -> new LivePolicy(
                rs.getString("tablename"),
                rs.getString("policyname"),
                roles(rs.getString("roles")),
                rs.getString("cmd"),
                rs.getString("qual"),
                rs.getString("with_check")));

        PolicyDriftReport report = evaluate(catalog, tables, policies);
        if (report.valid()) {
            log.info("Row policies match the catalog ({} tables, {} policies)",
                    catalog.tables().size(), policies.size());
        } else {
            log.error("Row policy drift: {}", report.errors());
        }
        return report;
    }

    static PolicyDriftReport evaluate(
            RowPolicyCatalog catalog, List<TableSecurity> tables, List<LivePolicy> policies) {
        Map<String, TableSecurity> security = tables.stream()
                .collect(Collectors.toMap(TableSecurity::table, Function.identity(), (a, b) -> a));
        Map<String, List<LivePolicy>> policiesByTable = policies.stream()
                .collect(Collectors.groupingBy(LivePolicy::table));
        Set<String> requestRoles = DatabaseRole.policyGoverned().stream()
                .map(DatabaseRole::roleName)
                .collect(Collectors.toSet());

        List<String> errors = new ArrayList<>();
        for (ProtectedTable table : catalog.tables()) {
            TableSecurity flags = security.get(table.name());
            if (flags == null) {
                errors.add(table.name() + ": table does not exist");
                continue;
            }
            if (!flags.enabled()) {
                errors.add(table.name() + ": row level security is not enabled");
            }
            if (!flags.forced()) {
                errors.add(table.name() + ": row level security is not forced");
            }
            List<LivePolicy> live = policiesByTable.getOrDefault(table.name(), List.of());
            for (DatabaseRole role : DatabaseRole.policyGoverned()) {
                table.shapeFor(role).ifPresent(shape -> checkRole(table, role, shape, live, errors));
            }
            for (LivePolicy policy : live) {
                checkTargets(table, policy, requestRoles, errors);
            }
        }
        return PolicyDriftReport.of(errors);
    }

    private static void checkRole(
            ProtectedTable table, DatabaseRole role, PolicyShape shape, List<LivePolicy> live,
            List<String> errors) {
        String roleName = role.roleName();
        List<String> expected = table.expectedPolicyNames(role);
        for (String name : expected) {
            LivePolicy policy = live.stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
            if (policy == null) {
                errors.add(table.name() + ": missing policy " + name + " for " + roleName);
            } else if (!policy.roles().contains(roleName)) {
                errors.add(table.name() + ": policy " + name + " does not target " + roleName);
            } else {
                checkPredicate(table, role, shape, policy, errors);
            }
        }
        for (LivePolicy policy : live) {
            if (policy.appliesTo(roleName) && !expected.contains(policy.name())) {
                errors.add(table.name() + ": unexpected policy " + policy.name() + " applies to "
                        + roleName);
            }
        }
    }

    private static void checkTargets(
            ProtectedTable table, LivePolicy policy, Set<String> requestRoles, List<String> errors) {
        Set<String> strays = new TreeSet<>(policy.roles());
        strays.removeAll(requestRoles);
        strays.remove(PUBLIC);
        for (String stray : strays) {
            errors.add(table.name() + ": policy " + policy.name() + " targets " + stray
                    + ", which is not a request role");
        }
    }

    private static void checkPredicate(
            ProtectedTable table, DatabaseRole role, PolicyShape shape, LivePolicy policy,
            List<String> errors) {
        String using = policy.using() == null ? "" : policy.using();
        // Without an explicit WITH CHECK the store checks written rows against USING.
        String check = policy.withCheck() == null ? using : policy.withCheck();
        boolean writes = !SELECT.equalsIgnoreCase(policy.command());

        if (shape == PolicyShape.DENY_ALL) {
            if (!using.equals("false")) {
                errors.add(table.name() + ": deny-all policy " + policy.name()
                        + " has predicate " + using);
            }
            if (writes && !check.equals("false")) {
                errors.add(table.name() + ": deny-all policy " + policy.name()
                        + " has check " + check);
            }
            return;
        }
        String accessor = accessorFor(shape.governingVariable().orElseThrow());
        String audience = "'" + AudienceRoleMapper.audienceFor(role).value() + "'";
        if (!reads(using, accessor, audience)) {
            errors.add(table.name() + ": policy " + policy.name() + " does not read " + accessor
                    + " and audience " + audience);
        }
        if (writes && !reads(check, accessor, audience)) {
            errors.add(table.name() + ": policy " + policy.name() + " check does not read " + accessor
                    + " and audience " + audience);
        }
    }

    private static boolean reads(String predicate, String accessor, String audience) {
        return predicate.contains(accessor)
                && predicate.contains("app.current_audience()")
                && predicate.contains(audience);
    }

    private static String accessorFor(SessionVariable variable) {
        return switch (variable) {
            case TENANT_ID -> "app.current_tenant_id()";
            case USER_ID -> "app.current_user_id()";
            case AUDIENCE -> "app.current_audience()";
        };
    }

    private static Set<String> roles(String joined) {
        if (joined == null || joined.isBlank()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(joined.split(",")));
    }
}
