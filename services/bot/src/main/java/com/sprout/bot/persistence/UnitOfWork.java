package com.sprout.bot.persistence;

import com.sprout.database.session.TransactionScope;

/**
 * The repositories of one unit of work, all sharing one transaction scope: everything a handler
 * writes commits together or not at all.
 *
 * <p>Created by {@link UnitOfWorkRunner}; never outlives the scope it wraps.
 */
public final class UnitOfWork {

    private final TransactionScope tx;
    private final UserRepository users;
    private final SpeciesRepository species;
    private final PlantRepository plants;
    private final ScheduleRepository schedules;
    private final ActionLogRepository actionLogs;

    public UnitOfWork(TransactionScope tx) {
        this.tx = tx;
        this.users = new UserRepository(tx);
        this.species = new SpeciesRepository(tx);
        this.plants = new PlantRepository(tx);
        this.schedules = new ScheduleRepository(tx);
        this.actionLogs = new ActionLogRepository(tx);
    }

    public UserRepository users() {
        return users;
    }

    public SpeciesRepository species() {
        return species;
    }

    public PlantRepository plants() {
        return plants;
    }

    public ScheduleRepository schedules() {
        return schedules;
    }

    public ActionLogRepository actionLogs() {
        return actionLogs;
    }

    /** The underlying scope, for statements the repositories do not cover. */
    public TransactionScope transaction() {
        return tx;
    }
}
