package com.fieldops.database.migration;

import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.configuration.FluentConfiguration;

/**
 * Flyway set-up shared by the start-up migration bean and the verification suite.
 *
 * <p>Clean is always disabled: dropping the schema would drop the row policies with it.
 */
public final class IsolationMigrations {

    /** Classpath location of the role, table and policy migrations. */
    public static final String DEFAULT_LOCATION = "classpath:db/migration/isolation";

    /** Placeholder holding the {@code ops_app} login password. */
    public static final String APP_LOGIN_PASSWORD_PLACEHOLDER = "appLoginPassword";

    private IsolationMigrations() {
        // utility class
    }

    public static FluentConfiguration configure(DataSource dataSource, String appLoginPassword) {
        return configure(dataSource, appLoginPassword, DEFAULT_LOCATION);
    }

    public static FluentConfiguration configure(
            DataSource dataSource, String appLoginPassword, String... locations) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        if (appLoginPassword == null || appLoginPassword.isBlank()) {
            throw new IllegalArgumentException("appLoginPassword must not be blank");
        }
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .placeholders(Map.of(APP_LOGIN_PASSWORD_PLACEHOLDER, appLoginPassword))
                .baselineOnMigrate(true)
                .cleanDisabled(true);
    }
}
