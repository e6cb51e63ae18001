package org.neuralchilli.planwright.core;

import com.hazelcast.map.IMap;
import org.neuralchilli.planwright.domain.StatusRecord;

import java.util.Optional;

/**
 * Keeps the committed status record in a Hazelcast map, one entry per store name.
 */
public class HazelcastSnapshotRepository implements SnapshotRepository {

    private final IMap<String, StatusRecord> snapshots;

    public HazelcastSnapshotRepository(IMap<String, StatusRecord> snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    public Optional<StatusRecord> load(String name) {
        return Optional.ofNullable(snapshots.get(name));
    }

    @Override
    public boolean commit(String name, long expectedRevision, StatusRecord next) {
        StatusRecord stored = snapshots.get(name);
        long actual = stored != null ? stored.revision() : 0L;
        if (actual != expectedRevision) {
            return false;
        }
        // Conditional writes, so a reclaimed lock holder cannot overwrite a newer commit
        if (stored == null) {
            return snapshots.putIfAbsent(name, next) == null;
        }
        return snapshots.replace(name, stored, next);
    }
}
