package com.sprout.bot.persistence;

import com.sprout.bot.config.DispatchSettings;
import com.sprout.database.DatabaseException;
import com.sprout.database.ErrorKind;
import com.sprout.database.PersistenceException;
import com.sprout.database.session.SessionManager;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs units of work in their own transaction and retries the ones that failed for a retriable
 * reason.
 *
 * <p>A unit of work that returns normally is committed; one that throws is rolled back completely
 * before the exception is looked at. Pool exhaustion, lost connections and transaction conflicts
 * are retried with exponential backoff up to {@link DispatchSettings#maxAttempts()} attempts; every
 * other failure, and the last retriable one, propagates unchanged.
 */
public class UnitOfWorkRunner {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWorkRunner.class);

    private final SessionManager sessions;
    private final DispatchSettings settings;
    private final MeterRegistry registry;

    public UnitOfWorkRunner(SessionManager sessions, DispatchSettings settings, MeterRegistry registry) {
        this.sessions = sessions;
        this.settings = settings;
        this.registry = registry;
    }

    /**
     * @param name short label for logs and metrics
     * @param work the unit of work; must be safe to run again after a rollback
     * @return whatever the work returned from its committed attempt
     */
    public <T> T run(String name, Function<UnitOfWork, T> work) {
        int attempt = 1;
        while (true) {
            try {
                return sessions.inTransaction(tx -> work.apply(new UnitOfWork(tx)));
            } catch (DatabaseException e) {
                if (!e.retriable() || attempt >= settings.maxAttempts()) {
                    throw e;
                }
                attempt++;
                Duration backoff = settings.backoffBefore(attempt);
                registry.counter("sprout.uow.retries", "kind", e.kind().name().toLowerCase(Locale.ROOT)).increment();
                log.warn("Unit of work '{}' failed with {} ({}); attempt {}/{} in {} ms",
                        name, e.kind(), e.getMessage(), attempt, settings.maxAttempts(), backoff.toMillis());
                sleep(name, backoff);
            }
        }
    }

    /** Same as {@link #run(String, Function)} for work without a result. */
    public void execute(String name, Consumer<UnitOfWork> work) {
        run(name, uow -> {
            work.accept(uow);
            return null;
        });
    }

    private static void sleep(String name, Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException(ErrorKind.CANCELLED,
                    "Interrupted while backing off before retrying '%s'".formatted(name), null, e);
        }
    }
}
