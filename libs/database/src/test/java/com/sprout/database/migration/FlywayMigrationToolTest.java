package com.sprout.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.sprout.database.DatabaseSettings;
import com.sprout.database.testing.InMemoryDatabases;
import java.net.ConnectException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.flywaydb.core.api.FlywayException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for {@link FlywayMigrationTool} driven through the {@link MigrationGate} against
 * in-memory H2 databases, plus unit tests of its failure classification.
 */
@DisplayName("FlywayMigrationTool")
class FlywayMigrationToolTest {

    private static final String ORDERED = "classpath:db/migration/ordered";
    private static final String ORDERED_PREFIX = "classpath:db/migration/ordered-prefix";
    private static final String BROKEN = "classpath:db/migration/broken";
    private static final String DRIFTED = "classpath:db/migration/ordered-drifted";

    private static MigrationGate gate(DatabaseSettings database, String location) {
        return new MigrationGate(new FlywayMigrationTool(database, MigrationSettings.defaults().withLocations(location)));
    }

    private static List<Integer> revisionLog(DatabaseSettings database) throws SQLException {
        try (Connection connection = DriverManager.getConnection(database.url(), database.username(), database.password());
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT revision FROM revision_log ORDER BY id")) {
            List<Integer> revisions = new ArrayList<>();
            while (rs.next()) {
                revisions.add(rs.getInt(1));
            }
            return revisions;
        }
    }

    @Nested
    @DisplayName("Ordered history")
    class OrderedHistory {

        @Test
        @DisplayName("brings an empty store to the latest revision, applying each once in order")
        void migratesEmptyStore() throws SQLException {
            DatabaseSettings database = InMemoryDatabases.fresh("ordered");

            MigrationReport report = gate(database, ORDERED).run();

            assertThat(report.succeeded()).isTrue();
            assertThat(report.startingVersion()).isNull();
            assertThat(report.finalVersion()).isEqualTo("3");
            assertThat(report.revisionsApplied()).isEqualTo(3);
            assertThat(revisionLog(database)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("second run is a no-op and leaves the effects untouched")
        void secondRunIsNoOp() throws SQLException {
            DatabaseSettings database = InMemoryDatabases.fresh("ordered_twice");
            gate(database, ORDERED).run();

            MigrationReport second = gate(database, ORDERED).run();

            assertThat(second.succeeded()).isTrue();
            assertThat(second.startingVersion()).isEqualTo("3");
            assertThat(second.finalVersion()).isEqualTo("3");
            assertThat(second.revisionsApplied()).isZero();
            assertThat(revisionLog(database)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("inspect lists applied and pending revisions")
        void inspectListsRevisions() {
            DatabaseSettings database = InMemoryDatabases.fresh("inspect");
            gate(database, ORDERED_PREFIX).run();

            SchemaState state = new FlywayMigrationTool(database, MigrationSettings.defaults().withLocations(ORDERED))
                    .inspect();

            assertThat(state.currentVersion()).isEqualTo("1");
            assertThat(state.applied()).containsExactly("1");
            assertThat(state.pending()).containsExactly("2", "3");
            assertThat(state.failed()).isEmpty();
            assertThat(state.unknown()).isEmpty();
            assertThat(state.drifted()).isEmpty();
            assertThat(state.upToDate()).isFalse();
        }
    }

    @Nested
    @DisplayName("Concurrent instances")
    class ConcurrentInstances {

        @Test
        @DisplayName("two gates racing on one store apply each revision once and both report version 3")
        void racingGatesApplyOnce() throws Exception {
            DatabaseSettings database = InMemoryDatabases.fresh("race");
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService instances = Executors.newFixedThreadPool(2);
            try {
                List<Future<MigrationReport>> reports = new ArrayList<>();
                for (int i = 0; i < 2; i++) {
                    reports.add(instances.submit(() -> {
                        go.await();
                        return gate(database, ORDERED).run();
                    }));
                }
                go.countDown();

                for (Future<MigrationReport> future : reports) {
                    MigrationReport report = future.get(60, TimeUnit.SECONDS);
                    assertThat(report.succeeded()).as("report %s", report).isTrue();
                    assertThat(report.finalVersion()).as("report %s", report).isEqualTo("3");
                }
                assertThat(reports.get(0).get().revisionsApplied() + reports.get(1).get().revisionsApplied())
                        .isEqualTo(3);
            } finally {
                instances.shutdownNow();
            }

            assertThat(revisionLog(database)).containsExactly(1, 2, 3);
        }
    }

    @Nested
    @DisplayName("Refusals")
    class Refusals {

        @Test
        @DisplayName("refuses a store that holds revisions this build does not know")
        void refusesStoreAheadOfBuild() {
            DatabaseSettings database = InMemoryDatabases.fresh("ahead");
            gate(database, ORDERED).run();

            MigrationReport report = gate(database, ORDERED_PREFIX).run();

            assertThat(report.succeeded()).isFalse();
            assertThat(report.failure()).isEqualTo(MigrationFailure.SCHEMA_INCONSISTENT);
            assertThat(report.detail()).contains("2", "3");
        }

        @Test
        @DisplayName("refuses a store whose applied revision was edited afterwards")
        void refusesDriftedRevision() throws SQLException {
            DatabaseSettings database = InMemoryDatabases.fresh("drifted");
            gate(database, ORDERED).run();

            SchemaState state = new FlywayMigrationTool(database, MigrationSettings.defaults().withLocations(DRIFTED))
                    .inspect();
            MigrationReport report = gate(database, DRIFTED).run();

            assertThat(state.pending()).isEmpty();
            assertThat(state.drifted()).containsExactly("3");
            assertThat(report.succeeded()).isFalse();
            assertThat(report.failure()).isEqualTo(MigrationFailure.SCHEMA_INCONSISTENT);
            assertThat(report.startingVersion()).isEqualTo("3");
            assertThat(revisionLog(database)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("a failing revision stops the run, and the next run finds it recorded as failed")
        void failingRevisionStops() throws SQLException {
            DatabaseSettings database = InMemoryDatabases.fresh("broken");

            MigrationReport first = gate(database, BROKEN).run();
            MigrationReport second = gate(database, BROKEN).run();

            // H2 has no transactional DDL, so Flyway records the failed revision in its history.
            assertThat(first.succeeded()).isFalse();
            assertThat(first.failure()).isEqualTo(MigrationFailure.REVISION_FAILED);
            assertThat(second.succeeded()).isFalse();
            assertThat(second.failure()).isEqualTo(MigrationFailure.PARTIALLY_APPLIED);
            assertThat(second.detail()).contains("2");

            try (Connection connection = DriverManager.getConnection(database.url(), "sa", "");
                    Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM widgets")) {
                rs.next();
                assertThat(rs.getInt(1)).as("revision 3 must never run").isZero();
            }
        }

        @Test
        @DisplayName("reports STORE_UNREACHABLE when nothing listens at the URL")
        void reportsUnreachableStore() {
            var database = new DatabaseSettings("jdbc:postgresql://127.0.0.1:1/sprout?connectTimeout=2", "sprout", "x");

            MigrationReport report = gate(database, ORDERED).run();

            assertThat(report.succeeded()).isFalse();
            assertThat(report.failure()).isEqualTo(MigrationFailure.STORE_UNREACHABLE);
        }

        @Test
        @DisplayName("describe never includes the password")
        void describeHidesPassword() {
            var database = new DatabaseSettings("jdbc:h2:mem:describe", "sa", "hunter2");

            String description = new FlywayMigrationTool(database, MigrationSettings.defaults()).describe();

            assertThat(description).contains("jdbc:h2:mem:describe").doesNotContain("hunter2");
        }
    }

    @Nested
    @DisplayName("Failure classification")
    class Classification {

        @Test
        @DisplayName("connection refused anywhere in the cause chain means STORE_UNREACHABLE")
        void connectionRefused() {
            var e = new FlywayException("Unable to obtain connection from database",
                    new SQLException("Connection refused", "08001", new ConnectException("refused")));

            assertThat(FlywayMigrationTool.classify(e)).isEqualTo(MigrationFailure.STORE_UNREACHABLE);
        }

        @Test
        @DisplayName("SQLState class 08 means STORE_UNREACHABLE")
        void connectionSqlState() {
            var e = new FlywayException("wrapped", new SQLNonTransientConnectionException("gone", "08006"));

            assertThat(FlywayMigrationTool.classify(e)).isEqualTo(MigrationFailure.STORE_UNREACHABLE);
        }

        @Test
        @DisplayName("exhausted lock retries mean MIGRATION_IN_PROGRESS")
        void lockRetries() {
            var e = new FlywayException("Number of retries exceeded while attempting to acquire PostgreSQL advisory lock");

            assertThat(FlywayMigrationTool.classify(e)).isEqualTo(MigrationFailure.MIGRATION_IN_PROGRESS);
        }

        @Test
        @DisplayName("a failed script means REVISION_FAILED")
        void scriptFailed() {
            var e = new FlywayException("Migration V2__add_column.sql failed",
                    new SQLException("syntax error", "42601"));

            assertThat(FlywayMigrationTool.classify(e)).isEqualTo(MigrationFailure.REVISION_FAILED);
        }

        @Test
        @DisplayName("anything else is TOOL_FAILURE")
        void anythingElse() {
            assertThat(FlywayMigrationTool.classify(new FlywayException("Unsupported database")))
                    .isEqualTo(MigrationFailure.TOOL_FAILURE);
        }
    }
}
