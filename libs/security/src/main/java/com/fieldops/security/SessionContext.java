package com.fieldops.security;

import java.util.Objects;
import java.util.Optional;

/**
 * The per-request security context a database transaction is established with.
 *
 * <p>WHY a record: built once per inbound request from authenticated claims, handed to the
 * context propagator as a parameter and discarded when the transaction ends. It is never cached,
 * stored in a thread-local or reused for a second request.
 *
 * <p>Absent identifiers are legal. They do not fail the request; they make every row policy that
 * depends on them match nothing.
 *
 * @param tenantId tenant the caller acts for, or null
 * @param userId individual caller, or null
 * @param audience caller audience, required
 */
public record SessionContext(TenantId tenantId, UserId userId, Audience audience) {

    public SessionContext {
        Objects.requireNonNull(audience, "audience must not be null");
    }

    /** Context for internal staff acting within one tenant. */
    public static SessionContext internal(Audience audience, TenantId tenantId, UserId userId) {
        if (!audience.isInternal()) {
            throw new IllegalArgumentException("audience '%s' is not internal".formatted(audience.value()));
        }
        return new SessionContext(tenantId, userId, audience);
    }

    /** Context for an external portal user. Portal callers never carry a tenant. */
    public static SessionContext portal(UserId userId) {
        return new SessionContext(null, userId, Audience.EXTERNAL_PORTAL);
    }

    /** Context for a background job processing work of one tenant. */
    public static SessionContext worker(TenantId tenantId) {
        return new SessionContext(tenantId, null, Audience.BACKGROUND_WORKER);
    }

    public Optional<TenantId> tenant() {
        return Optional.ofNullable(tenantId);
    }

    public Optional<UserId> user() {
        return Optional.ofNullable(userId);
    }

    /** Value for {@code app.tenant_id}: the UUID string, or empty when absent. Never null. */
    public String tenantSetting() {
        return tenantId == null ? "" : tenantId.toString();
    }

    /** Value for {@code app.user_id}: the UUID string, or empty when absent. Never null. */
    public String userSetting() {
        return userId == null ? "" : userId.toString();
    }

    /** Value for {@code app.aud}. */
    public String audienceSetting() {
        return audience.value();
    }
}
