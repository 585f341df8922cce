package com.fieldops.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of an individual caller. For the portal audience this is the owner key of
 * portal-owned rows.
 *
 * @param value the user UUID
 */
public record UserId(UUID value) {

    public UserId {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Parses a UUID-formatted string.
     *
     * @throws IllegalArgumentException if the string is not a UUID
     */
    public static UserId of(String value) {
        return new UserId(UUID.fromString(value));
    }

    public static UserId random() {
        return new UserId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
