package com.fieldops.database.verification;

import com.fieldops.security.TenantId;
import com.fieldops.security.UserId;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * What the fixture builder wrote: tenant A on the internal lane, tenant B on the external lane,
 * one staff user per tenant and portal users X and Y, both inside B.
 */
public record IsolationFixture(
        TenantId tenantA,
        TenantId tenantB,
        UserId staffA,
        UserId staffB,
        UserId portalX,
        UserId portalY,
        List<FixtureRow> rows) {

    public IsolationFixture {
        rows = List.copyOf(rows);
    }

    public Set<UUID> ids(String table) {
        return rows.stream().filter(r -> r.table().equals(table)).map(FixtureRow::id).collect(Collectors.toSet());
    }

    public Set<UUID> idsOf(String table, TenantId tenant) {
        return rows.stream()
                .filter(r -> r.table().equals(table) && r.tenant().equals(tenant))
                .map(FixtureRow::id)
                .collect(Collectors.toSet());
    }

    public Set<UUID> idsOwnedBy(String table, UserId owner) {
        return rows.stream()
                .filter(r -> r.table().equals(table) && Objects.equals(r.owner(), owner))
                .map(FixtureRow::id)
                .collect(Collectors.toSet());
    }
}
