package com.sprout.database.migration;

import java.util.List;

/**
 * Snapshot of the store's schema history compared with the revisions this build ships.
 *
 * @param currentVersion latest applied revision, or null for an empty store
 * @param applied revisions recorded as successfully applied, in order
 * @param pending known revisions not yet applied, in the order they will be applied
 * @param failed revisions recorded as failed
 * @param unknown revisions recorded as applied that this build does not know
 * @param drifted applied revisions whose recorded checksum or description no longer matches the
 *     build's copy
 */
public record SchemaState(
        String currentVersion,
        List<String> applied,
        List<String> pending,
        List<String> failed,
        List<String> unknown,
        List<String> drifted) {

    public SchemaState {
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
        failed = List.copyOf(failed);
        unknown = List.copyOf(unknown);
        drifted = List.copyOf(drifted);
    }

    /** A store with no history at all and the given revisions waiting. */
    public static SchemaState empty(List<String> pending) {
        return new SchemaState(null, List.of(), pending, List.of(), List.of(), List.of());
    }

    public boolean upToDate() {
        return pending.isEmpty() && failed.isEmpty() && unknown.isEmpty() && drifted.isEmpty();
    }
}
