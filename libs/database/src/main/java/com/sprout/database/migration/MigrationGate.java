package com.sprout.database.migration;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First phase of startup: brings the store to the latest known schema revision, or refuses.
 *
 * <p>The gate runs once per process, blocks the caller until it resolves, and never throws: every
 * outcome is a {@link MigrationReport}. Before asking the tool to migrate it inspects the recorded
 * history and refuses outright when
 *
 * <ul>
 *   <li>a revision is recorded as failed ({@link MigrationFailure#PARTIALLY_APPLIED}): a previous
 *       run was interrupted mid-revision on a store without transactional DDL, and somebody has to
 *       repair it;
 *   <li>a recorded revision is unknown to this build ({@link MigrationFailure#SCHEMA_INCONSISTENT}):
 *       the store is ahead of the code, which cannot interpret it;
 *   <li>an applied revision was edited after it ran ({@link MigrationFailure#SCHEMA_INCONSISTENT}).
 * </ul>
 *
 * <p>A second run against an already-migrated store is a no-op: same version, zero revisions
 * applied, success.
 */
public final class MigrationGate {

    private static final Logger log = LoggerFactory.getLogger(MigrationGate.class);

    private final MigrationTool tool;
    private final Counter revisionsApplied;
    private final MeterRegistry registry;

    public MigrationGate(MigrationTool tool) {
        this(tool, new SimpleMeterRegistry());
    }

    public MigrationGate(MigrationTool tool, MeterRegistry registry) {
        this.tool = Objects.requireNonNull(tool, "tool must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.revisionsApplied = Counter.builder("sprout.migration.revisions.applied")
                .description("Schema revisions applied by the migration gate")
                .register(registry);
    }

    /**
     * Inspects, then migrates. Blocks until the tool finishes.
     *
     * @return the report; check {@link MigrationReport#succeeded()} before starting anything else
     */
    public MigrationReport run() {
        long start = System.nanoTime();
        log.info("Migration gate starting against {}", tool.describe());

        SchemaState before;
        try {
            before = tool.inspect();
        } catch (MigrationToolException e) {
            return refuse(null, e.failure(), e.getMessage(), start);
        } catch (RuntimeException e) {
            log.error("Unexpected error while reading schema history", e);
            return refuse(null, MigrationFailure.TOOL_FAILURE, e.toString(), start);
        }

        String startingVersion = before.currentVersion();
        if (!before.failed().isEmpty()) {
            return refuse(startingVersion, MigrationFailure.PARTIALLY_APPLIED,
                    "revision(s) %s recorded as failed; repair the schema history before restarting"
                            .formatted(before.failed()),
                    start);
        }
        if (!before.unknown().isEmpty()) {
            return refuse(startingVersion, MigrationFailure.SCHEMA_INCONSISTENT,
                    "store holds revision(s) %s unknown to this build".formatted(before.unknown()),
                    start);
        }
        if (!before.drifted().isEmpty()) {
            return refuse(startingVersion, MigrationFailure.SCHEMA_INCONSISTENT,
                    "applied revision(s) %s differ from this build's copy".formatted(before.drifted()),
                    start);
        }
        if (before.pending().isEmpty()) {
            log.info("Schema already at version {}; nothing to apply", startingVersion);
            return succeed(startingVersion, startingVersion, 0, start);
        }

        log.info("Schema at version {}; applying {} pending revision(s): {}",
                startingVersion, before.pending().size(), before.pending());
        MigrationRun run;
        try {
            run = tool.migrate();
        } catch (MigrationToolException e) {
            return refuse(startingVersion, e.failure(), e.getMessage(), start);
        } catch (RuntimeException e) {
            log.error("Unexpected error while applying revisions", e);
            return refuse(startingVersion, MigrationFailure.TOOL_FAILURE, e.toString(), start);
        }

        revisionsApplied.increment(run.revisionsApplied());
        return succeed(startingVersion, run.targetVersion(), run.revisionsApplied(), start);
    }

    private MigrationReport succeed(String from, String to, int applied, long start) {
        Duration elapsed = elapsedSince(start);
        registry.counter("sprout.migration.runs", "outcome", "success").increment();
        log.info("Migration gate passed: version {} -> {}, {} revision(s) applied in {} ms",
                from, to, applied, elapsed.toMillis());
        return MigrationReport.success(from, to, applied, elapsed);
    }

    private MigrationReport refuse(String version, MigrationFailure failure, String detail, long start) {
        Duration elapsed = elapsedSince(start);
        registry.counter("sprout.migration.runs", "outcome", failure.name().toLowerCase(Locale.ROOT)).increment();
        log.error("Migration gate refused startup at version {} ({}{}): {}",
                version, failure, failure.retryOnRestart() ? ", retry on restart" : ", operator action needed",
                detail);
        return MigrationReport.failed(version, failure, detail, elapsed);
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
