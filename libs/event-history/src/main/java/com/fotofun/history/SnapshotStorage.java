package com.fotofun.history;

import java.util.List;
import java.util.Optional;

/**
 * Where {@link SnapshotManager} keeps its snapshots. Implementations report I/O
 * failures as {@link SnapshotStorageException}.
 */
public interface SnapshotStorage {

    /** Inserts or replaces the snapshot with the same id. */
    void save(Snapshot snapshot);

    Optional<Snapshot> load(String snapshotId);

    /** Removes the snapshot; unknown ids are ignored. */
    void delete(String snapshotId);

    List<Snapshot> list();
}
