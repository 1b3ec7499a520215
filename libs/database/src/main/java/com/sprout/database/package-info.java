/**
 * Database foundation for the Sprout plant-care bot.
 *
 * <p>Startup runs in two phases that share nothing but the database settings:
 *
 * <ul>
 *   <li>{@link com.sprout.database.migration.MigrationGate} brings the schema to the newest
 *       revision, or refuses to start
 *   <li>{@link com.sprout.database.session.SessionManager} owns the connection pool once the gate
 *       has passed
 * </ul>
 *
 * <p>Every failure crossing the package boundary is a {@link com.sprout.database.DatabaseException}
 * tagged with an {@link com.sprout.database.ErrorKind}, so callers decide retry policy on the kind
 * rather than on driver messages.
 */
package com.sprout.database;
