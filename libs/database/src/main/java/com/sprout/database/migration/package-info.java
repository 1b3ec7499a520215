/**
 * Schema migration gate built on Flyway.
 *
 * <p>Revisions live as {@code V{n}__{description}.sql} files under
 * {@code classpath:db/migration/sprout}; the location is configurable so the deployed image and the
 * tests apply exactly one revision set.
 *
 * @see com.sprout.database.migration.MigrationGate
 * @see com.sprout.database.migration.FlywayMigrationTool
 */
package com.sprout.database.migration;
