package com.fieldops.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of a tenant, the owner of all internal business rows.
 *
 * <p>A distinct type from {@link UserId} so a user id can never be bound where a tenant id is
 * expected.
 *
 * @param value the tenant UUID
 */
public record TenantId(UUID value) {

    public TenantId {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Parses a UUID-formatted string.
     *
     * @throws IllegalArgumentException if the string is not a UUID
     */
    public static TenantId of(String value) {
        return new TenantId(UUID.fromString(value));
    }

    public static TenantId random() {
        return new TenantId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
