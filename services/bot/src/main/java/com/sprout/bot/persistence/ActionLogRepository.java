package com.sprout.bot.persistence;

import com.sprout.database.session.RowMapper;
import com.sprout.database.session.Rows;
import com.sprout.database.session.TransactionScope;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

public class ActionLogRepository {

    private static final String COLUMNS = "id, user_id, plant_id, schedule_id, action_type, status, source, done_at, "
            + "plant_name_at_time, note";

    private static final RowMapper<ActionLog> MAPPER = row -> new ActionLog(
            row.getLong("id"),
            row.getLong("user_id"),
            Rows.nullableLong(row, "plant_id"),
            Rows.nullableLong(row, "schedule_id"),
            Rows.enumValue(row, "action_type", ActionType.class),
            Rows.enumValue(row, "status", ActionStatus.class),
            Rows.enumValue(row, "source", ActionSource.class),
            Rows.instant(row, "done_at"),
            row.getString("plant_name_at_time"),
            row.getString("note"));

    private final TransactionScope tx;

    public ActionLogRepository(TransactionScope tx) {
        this.tx = tx;
    }

    /** Records the outcome of a reminder fired by a schedule of the given plant. */
    public ActionLog recordFromSchedule(Schedule schedule, Plant plant, ActionStatus status, Instant doneAt, String note) {
        return insert(plant.userId(), plant.id(), schedule.id(), schedule.actionType(), status, ActionSource.SCHEDULE,
                doneAt, plant.name(), note);
    }

    /**
     * Records an action the user logged by hand.
     *
     * @param plant the plant acted on; null for an action not tied to a plant
     */
    public ActionLog recordManual(long userId, ActionType action, Plant plant, ActionStatus status, Instant doneAt,
            String note) {
        return insert(userId, plant != null ? plant.id() : null, null, action, status, ActionSource.MANUAL,
                doneAt, plant != null ? plant.name() : null, note);
    }

    public Optional<ActionLog> find(long logId) {
        return tx.queryOne("SELECT " + COLUMNS + " FROM action_logs WHERE id = ?", MAPPER, logId);
    }

    /** The user's history, newest first. */
    public List<ActionLog> listByUser(long userId, int limit, int offset) {
        return tx.query("SELECT " + COLUMNS + " FROM action_logs WHERE user_id = ? ORDER BY done_at DESC, id DESC "
                + "LIMIT ? OFFSET ?", MAPPER, userId, limit, offset);
    }

    public List<ActionLog> listByPlant(long plantId, int limit) {
        return tx.query("SELECT " + COLUMNS + " FROM action_logs WHERE plant_id = ? ORDER BY done_at DESC, id DESC "
                + "LIMIT ?", MAPPER, plantId, limit);
    }

    public long countByUser(long userId, ActionStatus status) {
        if (status == null) {
            return tx.queryOne("SELECT COUNT(*) FROM action_logs WHERE user_id = ?", row -> row.getLong(1), userId)
                    .orElse(0L);
        }
        return tx.queryOne("SELECT COUNT(*) FROM action_logs WHERE user_id = ? AND status = ?",
                row -> row.getLong(1), userId, status).orElse(0L);
    }

    /** The most recent entry of a schedule, used to compute its next reminder. */
    public Optional<ActionLog> lastForSchedule(long scheduleId) {
        List<ActionLog> rows = tx.query("SELECT " + COLUMNS + " FROM action_logs WHERE schedule_id = ? "
                + "ORDER BY done_at DESC, id DESC LIMIT 1", MAPPER, scheduleId);
        return rows.stream().findFirst();
    }

    public boolean delete(long logId) {
        return tx.update("DELETE FROM action_logs WHERE id = ?", logId) == 1;
    }

    private ActionLog insert(long userId, Long plantId, Long scheduleId, ActionType action, ActionStatus status,
            ActionSource source, Instant doneAt, String plantName, String note) {
        Instant at = (doneAt != null ? doneAt : Instant.now()).truncatedTo(ChronoUnit.MICROS);
        long id = tx.insert("INSERT INTO action_logs (user_id, plant_id, schedule_id, action_type, status, source, "
                        + "done_at, plant_name_at_time, note) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                userId, plantId, scheduleId, action, status, source, at, plantName, note);
        return new ActionLog(id, userId, plantId, scheduleId, action, status, source, at, plantName, note);
    }
}
