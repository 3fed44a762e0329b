package io.bankseed.orchestrator;

import io.bankseed.model.CheckpointPayload;
import io.bankseed.model.Cursor;
import io.bankseed.model.EntityType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Live cursors of one execution. A cursor is published only after its batch is durable, so
 * any snapshot is a valid resume point.
 */
public final class CursorBoard {
    private final Map<EntityType, Cursor> cursors = new EnumMap<>(EntityType.class);
    private long version;
    private long batches;

    public CursorBoard(CheckpointPayload initial) {
        cursors.putAll(initial.cursors());
    }

    public synchronized Cursor cursor(EntityType type) {
        return cursors.getOrDefault(type, Cursor.START);
    }

    /**
     * @return number of batches published so far by this execution
     */
    public synchronized long publish(EntityType type, Cursor cursor) {
        cursors.put(type, cursor);
        version++;
        return ++batches;
    }

    public synchronized void reset(EntityType type, Cursor cursor) {
        cursors.put(type, cursor);
        version++;
    }

    public synchronized long version() {
        return version;
    }

    public synchronized CheckpointPayload snapshot() {
        return CheckpointPayload.of(cursors);
    }

    synchronized VersionedPayload versionedSnapshot() {
        return new VersionedPayload(version, CheckpointPayload.of(cursors));
    }

    record VersionedPayload(long version, CheckpointPayload payload) {
    }
}
