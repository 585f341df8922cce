package com.fieldops.security;

/**
 * Maps an {@link Audience} to the database principal its transactions run as.
 *
 * <p>The mapping is a fixed table. There is no default branch: an audience without a mapping is
 * a configuration bug and is rejected, never widened to a more privileged role.
 *
 * <table>
 *   <caption>Audience to role</caption>
 *   <tr><th>Audience</th><th>Role</th></tr>
 *   <tr><td>web</td><td>ops_web</td></tr>
 *   <tr><td>studio</td><td>ops_studio</td></tr>
 *   <tr><td>portal</td><td>ops_portal</td></tr>
 *   <tr><td>worker</td><td>ops_worker</td></tr>
 *   <tr><td>service</td><td>ops_service (fixtures and migrations only)</td></tr>
 * </table>
 */
public final class AudienceRoleMapper {

    private AudienceRoleMapper() {
        // utility class
    }

    /**
     * Returns the database role for the given audience.
     *
     * @param audience the caller's audience
     * @return the mapped role
     * @throws UnknownAudienceException if the audience is null
     */
    public static DatabaseRole roleFor(Audience audience) {
        if (audience == null) {
            throw new UnknownAudienceException(null);
        }
        return switch (audience) {
            case INTERNAL_WEB -> DatabaseRole.WEB;
            case INTERNAL_STUDIO -> DatabaseRole.STUDIO;
            case EXTERNAL_PORTAL -> DatabaseRole.PORTAL;
            case BACKGROUND_WORKER -> DatabaseRole.WORKER;
            case TRUSTED_SERVICE -> DatabaseRole.SERVICE;
        };
    }

    /**
     * Returns the database role for an audience wire literal.
     *
     * @param audienceLiteral the literal from the {@code aud} claim (e.g., "web")
     * @return the mapped role
     * @throws UnknownAudienceException if the literal is not a known audience
     */
    public static DatabaseRole roleFor(String audienceLiteral) {
        return roleFor(
                Audience.fromString(audienceLiteral)
                        .orElseThrow(() -> new UnknownAudienceException(audienceLiteral)));
    }

    /**
     * Returns the audience whose transactions run as the given role. Row policies compare
     * {@code app.aud} against this audience's literal.
     *
     * @param role a database role
     * @return the single audience mapped to the role
     */
    public static Audience audienceFor(DatabaseRole role) {
        return switch (role) {
            case WEB -> Audience.INTERNAL_WEB;
            case STUDIO -> Audience.INTERNAL_STUDIO;
            case PORTAL -> Audience.EXTERNAL_PORTAL;
            case WORKER -> Audience.BACKGROUND_WORKER;
            case SERVICE -> Audience.TRUSTED_SERVICE;
        };
    }
}
