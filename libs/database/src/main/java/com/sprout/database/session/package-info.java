/**
 * Pooled connection and transaction scoping on HikariCP.
 */
package com.sprout.database.session;
