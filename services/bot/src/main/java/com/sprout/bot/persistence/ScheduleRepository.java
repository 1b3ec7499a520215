package com.sprout.bot.persistence;

import com.sprout.database.session.RowMapper;
import com.sprout.database.session.Rows;
import com.sprout.database.session.TransactionScope;
import java.util.List;
import java.util.Optional;

public class ScheduleRepository {

    private static final String COLUMNS = "id, plant_id, action_type, schedule_type, interval_days, weekly_mask, "
            + "local_time, active, custom_title, custom_note_template";

    private static final RowMapper<Schedule> MAPPER = row -> new Schedule(
            row.getLong("id"),
            row.getLong("plant_id"),
            Rows.enumValue(row, "action_type", ActionType.class),
            Rows.enumValue(row, "schedule_type", ScheduleType.class),
            Rows.nullableInt(row, "interval_days"),
            Rows.nullableInt(row, "weekly_mask"),
            Rows.localTime(row, "local_time"),
            row.getBoolean("active"),
            row.getString("custom_title"),
            row.getString("custom_note_template"));

    private final TransactionScope tx;

    public ScheduleRepository(TransactionScope tx) {
        this.tx = tx;
    }

    public Schedule create(NewSchedule schedule) {
        long id = tx.insert("INSERT INTO schedules (plant_id, action_type, schedule_type, interval_days, weekly_mask, "
                        + "local_time, active, custom_title, custom_note_template) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                schedule.plantId(), schedule.actionType(), schedule.scheduleType(), schedule.intervalDays(),
                schedule.weeklyMask(), schedule.localTime(), true, schedule.customTitle(),
                schedule.customNoteTemplate());
        return new Schedule(id, schedule.plantId(), schedule.actionType(), schedule.scheduleType(),
                schedule.intervalDays(), schedule.weeklyMask(), schedule.localTime(), true,
                schedule.customTitle(), schedule.customNoteTemplate());
    }

    public Optional<Schedule> find(long scheduleId) {
        return tx.queryOne("SELECT " + COLUMNS + " FROM schedules WHERE id = ?", MAPPER, scheduleId);
    }

    /** The plant's schedules, newest first. */
    public List<Schedule> listByPlant(long plantId) {
        return tx.query("SELECT " + COLUMNS + " FROM schedules WHERE plant_id = ? ORDER BY id DESC", MAPPER, plantId);
    }

    public List<Schedule> listByPlantAndAction(long plantId, ActionType action) {
        return tx.query("SELECT " + COLUMNS + " FROM schedules WHERE plant_id = ? AND action_type = ? ORDER BY id DESC",
                MAPPER, plantId, action);
    }

    /** Every active schedule, for rebuilding reminder jobs at startup. */
    public List<Schedule> listActive() {
        return tx.query("SELECT " + COLUMNS + " FROM schedules WHERE active = TRUE ORDER BY id", MAPPER);
    }

    public boolean setActive(long scheduleId, boolean active) {
        return tx.update("UPDATE schedules SET active = ? WHERE id = ?", active, scheduleId) == 1;
    }

    public boolean delete(long scheduleId) {
        return tx.update("DELETE FROM schedules WHERE id = ?", scheduleId) == 1;
    }
}
