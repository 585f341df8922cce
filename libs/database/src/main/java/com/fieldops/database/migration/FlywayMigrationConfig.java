package com.fieldops.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;

/**
 * Runs the isolation migrations on start-up with their own administrative connection.
 *
 * <p>WHY a dedicated DataSource: the application pool logs in as {@code ops_app}, which may
 * neither create roles nor alter policies. The migration connection is built from
 * {@link MigrationProperties} and used for nothing else.
 *
 * <p>Ordered before {@link FlywayAutoConfiguration}, whose own Flyway bean backs off once this
 * one exists.
 */
@AutoConfiguration(before = FlywayAutoConfiguration.class)
@EnableConfigurationProperties(MigrationProperties.class)
@ConditionalOnProperty(prefix = "fieldops.migration", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    /** Bean name of the isolation Flyway instance. */
    public static final String ISOLATION_FLYWAY_BEAN = "isolationFlyway";

    @Bean(name = ISOLATION_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway isolationFlyway(MigrationProperties properties) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();

        return IsolationMigrations.configure(
                        dataSource, properties.appLoginPassword(), properties.locations().split(","))
                .load();
    }
}
