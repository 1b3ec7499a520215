package com.sprout.bot.persistence;

import com.sprout.database.session.RowMapper;
import com.sprout.database.session.Rows;
import com.sprout.database.session.TransactionScope;
import java.util.List;
import java.util.Optional;

public class PlantRepository {

    private static final String COLUMNS = "id, user_id, name, species_id";

    private static final RowMapper<Plant> MAPPER = row -> new Plant(
            row.getLong("id"),
            row.getLong("user_id"),
            row.getString("name"),
            Rows.nullableLong(row, "species_id"));

    private final TransactionScope tx;

    public PlantRepository(TransactionScope tx) {
        this.tx = tx;
    }

    public Plant create(long userId, String name, Long speciesId) {
        long id = tx.insert("INSERT INTO plants (user_id, name, species_id) VALUES (?, ?, ?)", userId, name, speciesId);
        return new Plant(id, userId, name, speciesId);
    }

    public Optional<Plant> find(long plantId) {
        return tx.queryOne("SELECT " + COLUMNS + " FROM plants WHERE id = ?", MAPPER, plantId);
    }

    /** The user's plants in creation order. */
    public List<Plant> listByUser(long userId) {
        return tx.query("SELECT " + COLUMNS + " FROM plants WHERE user_id = ? ORDER BY id", MAPPER, userId);
    }

    public boolean rename(long plantId, String name) {
        return tx.update("UPDATE plants SET name = ? WHERE id = ?", name, plantId) == 1;
    }

    public boolean setSpecies(long plantId, Long speciesId) {
        return tx.update("UPDATE plants SET species_id = ? WHERE id = ?", speciesId, plantId) == 1;
    }

    /** Deletes the plant and its schedules; its history entries stay. */
    public boolean delete(long plantId) {
        return tx.update("DELETE FROM plants WHERE id = ?", plantId) == 1;
    }
}
