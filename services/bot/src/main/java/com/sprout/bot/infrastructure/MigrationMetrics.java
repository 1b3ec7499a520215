package com.sprout.bot.infrastructure;

import com.sprout.database.migration.MigrationReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Publishes the startup migration run to the application's registry.
 *
 * <p>The gate runs before the application context, and therefore before that registry, exists. Its
 * report is replayed here once the context binds its meters.
 */
public class MigrationMetrics implements MeterBinder {

    private final MigrationReport report;

    public MigrationMetrics(MigrationReport report) {
        this.report = report;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Counter.builder("sprout.migration.runs")
                .description("Migration gate runs by outcome")
                .tag("outcome", "success")
                .register(registry)
                .increment();
        Counter.builder("sprout.migration.revisions.applied")
                .description("Schema revisions applied by the migration gate")
                .register(registry)
                .increment(report.revisionsApplied());
        Timer.builder("sprout.migration.duration")
                .description("Time the migration gate took before startup")
                .register(registry)
                .record(report.elapsed());
        Gauge.builder("sprout.migration.schema.version", report, r -> numericVersion(r.finalVersion()))
                .description("Schema version the migration gate left the store at")
                .register(registry);
    }

    private static double numericVersion(String version) {
        if (version == null) {
            return 0;
        }
        try {
            return Double.parseDouble(version);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
