package com.fieldops.security;

import java.util.Optional;

/**
 * Caller audience classification, resolved from the {@code aud} claim of an authenticated request.
 *
 * <p>WHY an enum: the set of audiences is closed. Every transaction runs under exactly one audience
 * for its lifetime, and the audience alone selects the database principal the transaction runs as
 * (see {@link AudienceRoleMapper}).
 */
public enum Audience {

    INTERNAL_WEB("web"),
    INTERNAL_STUDIO("studio"),
    EXTERNAL_PORTAL("portal"),
    BACKGROUND_WORKER("worker"),
    TRUSTED_SERVICE("service");

    private final String value;

    Audience(String value) {
        this.value = value;
    }

    /**
     * The wire literal used in the {@code aud} claim and in the {@code app.aud} session variable.
     */
    public String value() {
        return value;
    }

    /** Whether this audience belongs to internal staff or internal automation. */
    public boolean isInternal() {
        return this == INTERNAL_WEB || this == INTERNAL_STUDIO || this == BACKGROUND_WORKER;
    }

    /**
     * Looks up an Audience by its wire literal (e.g., "portal").
     *
     * @param value the literal to match, may be null
     * @return the matching Audience, or empty if not found
     */
    public static Optional<Audience> fromString(String value) {
        for (Audience audience : values()) {
            if (audience.value.equals(value)) {
                return Optional.of(audience);
            }
        }
        return Optional.empty();
    }
}
