package com.fotofun.history;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemorySnapshotStorage implements SnapshotStorage {

    private final Map<String, Snapshot> snapshots = new LinkedHashMap<>();

    @Override
    public synchronized void save(Snapshot snapshot) {
        snapshots.put(snapshot.id(), snapshot);
    }

    @Override
    public synchronized Optional<Snapshot> load(String snapshotId) {
        return Optional.ofNullable(snapshots.get(snapshotId));
    }

    @Override
    public synchronized void delete(String snapshotId) {
        snapshots.remove(snapshotId);
    }

    @Override
    public synchronized List<Snapshot> list() {
        return new ArrayList<>(snapshots.values());
    }
}
