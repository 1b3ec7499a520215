package com.sprout.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sprout.database.ErrorKind;
import com.sprout.database.MigrationFatalException;
import com.sprout.database.testing.ScriptedMigrationTool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MigrationGate} against a scripted tool: ordering of inspect and migrate, refusal
 * rules and the report it produces.
 */
@DisplayName("MigrationGate")
class MigrationGateTest {

    @Nested
    @DisplayName("Pending revisions")
    class PendingRevisions {

        @Test
        @DisplayName("applies all pending revisions from an empty store")
        void appliesAllFromEmptyStore() {
            var tool = new ScriptedMigrationTool("1", "2", "3");

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.succeeded()).isTrue();
            assertThat(report.startingVersion()).isNull();
            assertThat(report.finalVersion()).isEqualTo("3");
            assertThat(report.revisionsApplied()).isEqualTo(3);
            assertThat(report.failure()).isNull();
            assertThat(tool.applied()).containsExactly("1", "2", "3");
        }

        @Test
        @DisplayName("applies only what is missing on a partly migrated store")
        void appliesOnlyMissing() {
            var tool = new ScriptedMigrationTool("3").withApplied("1", "2");

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.succeeded()).isTrue();
            assertThat(report.startingVersion()).isEqualTo("2");
            assertThat(report.finalVersion()).isEqualTo("3");
            assertThat(report.revisionsApplied()).isEqualTo(1);
        }

        @Test
        @DisplayName("second run is a no-op at the same version")
        void secondRunIsNoOp() {
            var tool = new ScriptedMigrationTool("1", "2", "3");
            var gate = new MigrationGate(tool);

            MigrationReport first = gate.run();
            MigrationReport second = gate.run();

            assertThat(first.succeeded()).isTrue();
            assertThat(second.succeeded()).isTrue();
            assertThat(second.startingVersion()).isEqualTo("3");
            assertThat(second.finalVersion()).isEqualTo("3");
            assertThat(second.revisionsApplied()).isZero();
            assertThat(tool.migrateCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("counts applied revisions in the meter registry")
        void countsAppliedRevisions() {
            var registry = new SimpleMeterRegistry();
            var gate = new MigrationGate(new ScriptedMigrationTool("1", "2"), registry);

            gate.run();

            assertThat(registry.get("sprout.migration.revisions.applied").counter().count()).isEqualTo(2.0);
            assertThat(registry.get("sprout.migration.runs").tag("outcome", "success").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Refusals")
    class Refusals {

        @Test
        @DisplayName("refuses with PARTIALLY_APPLIED when a revision is recorded as failed")
        void refusesOnFailedRevision() {
            var tool = new ScriptedMigrationTool("3").withApplied("1").withFailed("2");

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.succeeded()).isFalse();
            assertThat(report.failure()).isEqualTo(MigrationFailure.PARTIALLY_APPLIED);
            assertThat(report.detail()).contains("2");
            assertThat(report.finalVersion()).isEqualTo("1");
            assertThat(tool.migrateCalls()).isZero();
        }

        @Test
        @DisplayName("refuses with SCHEMA_INCONSISTENT when the store is ahead of the build")
        void refusesOnUnknownRevision() {
            var tool = new ScriptedMigrationTool().withApplied("1", "2").withUnknown("4");

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.failure()).isEqualTo(MigrationFailure.SCHEMA_INCONSISTENT);
            assertThat(tool.migrateCalls()).isZero();
        }

        @Test
        @DisplayName("refuses with SCHEMA_INCONSISTENT when an applied revision changed, even with nothing pending")
        void refusesOnDriftedRevision() {
            var tool = new ScriptedMigrationTool().withApplied("1", "2", "3").withDrifted("3");

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.succeeded()).isFalse();
            assertThat(report.failure()).isEqualTo(MigrationFailure.SCHEMA_INCONSISTENT);
            assertThat(report.detail()).contains("3");
            assertThat(tool.migrateCalls()).isZero();
        }

        @Test
        @DisplayName("reports STORE_UNREACHABLE from inspect without migrating")
        void reportsUnreachableStore() {
            var tool = new ScriptedMigrationTool("1").failInspect(MigrationFailure.STORE_UNREACHABLE);

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.succeeded()).isFalse();
            assertThat(report.failure()).isEqualTo(MigrationFailure.STORE_UNREACHABLE);
            assertThat(report.failure().retryOnRestart()).isTrue();
            assertThat(tool.migrateCalls()).isZero();
        }

        @Test
        @DisplayName("reports the tool's failure reason when migrate fails")
        void reportsMigrateFailure() {
            var tool = new ScriptedMigrationTool("1").failMigrate(MigrationFailure.MIGRATION_IN_PROGRESS);

            MigrationReport report = new MigrationGate(tool).run();

            assertThat(report.failure()).isEqualTo(MigrationFailure.MIGRATION_IN_PROGRESS);
            assertThat(report.revisionsApplied()).isZero();
        }

        @Test
        @DisplayName("maps unexpected runtime errors to TOOL_FAILURE instead of throwing")
        void mapsUnexpectedErrors() {
            MigrationTool exploding = new MigrationTool() {
                @Override
                public SchemaState inspect() {
                    throw new IllegalStateException("boom");
                }

                @Override
                public MigrationRun migrate() {
                    throw new AssertionError("must not be called");
                }

                @Override
                public String describe() {
                    return "exploding";
                }
            };

            MigrationReport report = new MigrationGate(exploding).run();

            assertThat(report.failure()).isEqualTo(MigrationFailure.TOOL_FAILURE);
            assertThat(report.detail()).contains("boom");
        }

        @Test
        @DisplayName("orThrow raises MigrationFatalException carrying the reason")
        void orThrowRaises() {
            var tool = new ScriptedMigrationTool().withFailed("1");
            MigrationReport report = new MigrationGate(tool).run();

            assertThatThrownBy(report::orThrow)
                    .isInstanceOf(MigrationFatalException.class)
                    .satisfies(e -> {
                        var fatal = (MigrationFatalException) e;
                        assertThat(fatal.failure()).isEqualTo(MigrationFailure.PARTIALLY_APPLIED);
                        assertThat(fatal.kind()).isEqualTo(ErrorKind.MIGRATION_FATAL);
                        assertThat(fatal.retriable()).isFalse();
                    });
        }
    }

    @Nested
    @DisplayName("MigrationReport")
    class Report {

        @Test
        @DisplayName("rejects a success that carries a failure")
        void rejectsInconsistentSuccess() {
            assertThatThrownBy(() -> new MigrationReport(true, null, "1", 1,
                    MigrationFailure.TOOL_FAILURE, "x", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a failed report keeps the starting version as final version")
        void failedKeepsVersion() {
            MigrationReport report = MigrationReport.failed("2", MigrationFailure.REVISION_FAILED, "bad sql", null);

            assertThat(report.finalVersion()).isEqualTo("2");
            assertThat(report.elapsed()).isNotNull();
        }
    }
}
