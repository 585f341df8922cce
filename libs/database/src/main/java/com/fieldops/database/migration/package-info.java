/**
 * Flyway configuration for the isolation migrations under {@code db/migration/isolation}.
 *
 * <ul>
 *   <li>{@link com.fieldops.database.migration.MigrationProperties}: administrative connection
 *       and placeholders
 *   <li>{@link com.fieldops.database.migration.IsolationMigrations}: shared Flyway set-up
 *   <li>{@link com.fieldops.database.migration.FlywayMigrationConfig}: migrate on start-up
 * </ul>
 */
package com.fieldops.database.migration;
