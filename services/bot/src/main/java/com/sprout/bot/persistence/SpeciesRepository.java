package com.sprout.bot.persistence;

import com.sprout.database.session.RowMapper;
import com.sprout.database.session.TransactionScope;
import java.util.List;
import java.util.Optional;

public class SpeciesRepository {

    private static final RowMapper<Species> MAPPER =
            row -> new Species(row.getLong("id"), row.getLong("user_id"), row.getString("name"));

    private final TransactionScope tx;

    public SpeciesRepository(TransactionScope tx) {
        this.tx = tx;
    }

    public Optional<Species> find(long speciesId) {
        return tx.queryOne("SELECT id, user_id, name FROM species WHERE id = ?", MAPPER, speciesId);
    }

    public Optional<Species> findByName(long userId, String name) {
        return tx.queryOne("SELECT id, user_id, name FROM species WHERE user_id = ? AND name = ?",
                MAPPER, userId, name);
    }

    public Species create(long userId, String name) {
        long id = tx.insert("INSERT INTO species (user_id, name) VALUES (?, ?)", userId, name);
        return new Species(id, userId, name);
    }

    public Species getOrCreate(long userId, String name) {
        return findByName(userId, name).orElseGet(() -> create(userId, name));
    }

    public boolean rename(long speciesId, String name) {
        return tx.update("UPDATE species SET name = ? WHERE id = ?", name, speciesId) == 1;
    }

    /** Deletes the species; its plants keep existing without one. */
    public boolean delete(long speciesId) {
        return tx.update("DELETE FROM species WHERE id = ?", speciesId) == 1;
    }

    /** The user's species ordered by name. */
    public List<Species> listByUser(long userId) {
        return tx.query("SELECT id, user_id, name FROM species WHERE user_id = ? ORDER BY name", MAPPER, userId);
    }
}
