package com.fieldops.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and placeholder settings for the isolation migrations, bound from
 * {@code fieldops.migration.*}.
 *
 * <p>Migrations run with administrative credentials, never with the {@code ops_app} pool login:
 * they create roles, enable row security and install policies.
 *
 * <pre>{@code
 * fieldops:
 *   migration:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/fieldops
 *     username: fieldops_admin
 *     password: ${FIELDOPS_ADMIN_PASSWORD}
 *     app-login-password: ${FIELDOPS_APP_LOGIN_PASSWORD}
 * }</pre>
 *
 * @param url JDBC URL of the store
 * @param username administrative user that owns the schema
 * @param password administrative password
 * @param locations Flyway locations, defaults to {@link IsolationMigrations#DEFAULT_LOCATION}
 * @param appLoginPassword password given to the {@code ops_app} login role on creation
 * @param enabled whether to migrate on start-up
 */
@Validated
@ConfigurationProperties(prefix = "fieldops.migration")
public record MigrationProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        @NotBlank String appLoginPassword,
        boolean enabled) {

    public MigrationProperties {
        if (locations == null || locations.isBlank()) {
            locations = IsolationMigrations.DEFAULT_LOCATION;
        }
    }
}
