package com.fieldops.security;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link SessionContext} for an inbound request from authenticated claims.
 *
 * <p>This is the only contract between the authentication collaborator and the isolation layer:
 * either a well-formed context comes out, or the request is rejected here, before any transaction
 * is opened.
 *
 * <ul>
 *   <li>blank or absent ids become absent fields (fail-closed at the store, not an error)
 *   <li>present but malformed ids are rejected
 *   <li>unknown audiences are rejected with {@link UnknownAudienceException}
 *   <li>the trusted-service audience is rejected: it is reserved for fixtures and migrations
 * </ul>
 */
public final class SessionContextResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionContextResolver.class);

    private SessionContextResolver() {
        // utility class
    }

    /**
     * Resolves claims into a session context.
     *
     * @param claims claims of an authenticated request
     * @return a fresh session context for this request
     * @throws UnknownAudienceException if the audience claim is missing or unknown
     * @throws InvalidSessionContextException if an id is malformed or the audience may not serve
     *     requests
     */
    public static SessionContext resolve(AuthenticatedClaims claims) {
        if (claims == null) {
            throw new InvalidSessionContextException("claims must not be null");
        }
        Audience audience =
                Audience.fromString(claims.audience())
                        .orElseThrow(() -> new UnknownAudienceException(claims.audience()));
        if (audience == Audience.TRUSTED_SERVICE) {
            throw new InvalidSessionContextException(
                    "audience 'service' is not permitted for request handling");
        }

        UUID tenant = parse("tenantId", claims.tenantId());
        UUID user = parse("userId", claims.userId());

        if (tenant == null && user == null) {
            log.debug("Resolved {} context without tenant or user; protected tables will read empty",
                    audience.value());
        }

        return new SessionContext(
                tenant == null ? null : new TenantId(tenant),
                user == null ? null : new UserId(user),
                audience);
    }

    private static UUID parse(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidSessionContextException(field + " must be UUID-formatted", e);
        }
    }
}
