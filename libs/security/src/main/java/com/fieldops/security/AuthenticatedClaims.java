package com.fieldops.security;

/**
 * Claims produced by the authentication collaborator for one inbound request.
 *
 * <p>Raw strings as they arrive from a validated token; {@link SessionContextResolver} turns them
 * into a typed {@link SessionContext}.
 *
 * @param tenantId the {@code tenant_id} claim, may be null or blank
 * @param userId the {@code sub} claim, may be null or blank
 * @param audience the {@code aud} claim
 */
public record AuthenticatedClaims(String tenantId, String userId, String audience) {}
