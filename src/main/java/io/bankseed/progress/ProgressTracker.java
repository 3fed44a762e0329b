package io.bankseed.progress;

import io.bankseed.generator.VolumePlanner;
import io.bankseed.model.Checkpoint;
import io.bankseed.model.CheckpointPayload;
import io.bankseed.model.Cursor;
import io.bankseed.model.EntityType;
import io.bankseed.model.TaskView;
import io.bankseed.storage.CheckpointStore;
import io.bankseed.storage.TaskStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Derives progress from cursors. While an execution is live its in-memory cursor board is
 * read; afterwards the latest lineage checkpoint is. Never writes task state.
 */
public final class ProgressTracker {
    static final double RATE_KEEP = 0.7d;
    static final double RATE_NEW = 0.3d;

    private final TaskStore taskStore;
    private final CheckpointStore checkpointStore;
    private final VolumePlanner planner;
    private final Clock clock;
    private final Map<String, LiveExecution> live = new ConcurrentHashMap<>();

    public ProgressTracker(TaskStore taskStore, CheckpointStore checkpointStore, VolumePlanner planner, Clock clock) {
        this.taskStore = taskStore;
        this.checkpointStore = checkpointStore;
        this.planner = planner;
        this.clock = clock;
    }

    public void begin(String taskId, Supplier<CheckpointPayload> cursors) {
        CheckpointPayload initial = cursors.get();
        live.put(taskId, new LiveExecution(cursors, clock.millis(), initial.totalProduced()));
    }

    public void recordBatch(String taskId, EntityType type, long count, long elapsedMs) {
        LiveExecution execution = live.get(taskId);
        if (execution == null || count <= 0) {
            return;
        }
        double instant = count * 1000.0d / Math.max(1L, elapsedMs);
        execution.rates.merge(type, instant, (old, fresh) -> RATE_KEEP * old + RATE_NEW * fresh);
    }

    public void end(String taskId) {
        live.remove(taskId);
    }

    public boolean isLive(String taskId) {
        return live.containsKey(taskId);
    }

    public ProgressSnapshot snapshot(String taskId) {
        TaskView task = taskStore.getTask(taskId)
                .orElseThrow(() -> new NoSuchElementException("Task not found: " + taskId));
        Map<EntityType, Long> planned = planner.plan(task.kind(), task.window());
        LiveExecution execution = live.get(taskId);
        CheckpointPayload cursors;
        if (execution != null) {
            cursors = execution.cursors.get();
        } else {
            cursors = checkpointStore.latest(task.lineageKey()).map(Checkpoint::payload).orElse(CheckpointPayload.EMPTY);
        }

        long producedTotal = 0L;
        long plannedTotal = 0L;
        List<ProgressSnapshot.EntityProgress> entities = new ArrayList<>();
        for (Map.Entry<EntityType, Long> e : planned.entrySet()) {
            Cursor cursor = cursors.cursor(e.getKey());
            long done = Math.min(cursor.produced(), e.getValue());
            producedTotal += done;
            plannedTotal += e.getValue();
            double rate = execution == null ? 0.0d : execution.rates.getOrDefault(e.getKey(), 0.0d);
            entities.add(new ProgressSnapshot.EntityProgress(e.getKey(), done, e.getValue(), percent(done, e.getValue()), rate));
        }

        double throughput = 0.0d;
        Double eta = null;
        if (execution != null) {
            long elapsedMs = Math.max(1L, clock.millis() - execution.startedAtMs);
            long producedNow = Math.max(0L, cursors.totalProduced() - execution.producedAtStart);
            throughput = producedNow * 1000.0d / elapsedMs;
            if (throughput > 0.0d) {
                eta = Math.max(0L, plannedTotal - producedTotal) / throughput;
            }
        } else if (producedTotal >= plannedTotal) {
            eta = 0.0d;
        }
        return new ProgressSnapshot(
                taskId,
                task.status(),
                execution != null,
                producedTotal,
                plannedTotal,
                percent(producedTotal, plannedTotal),
                throughput,
                eta,
                entities
        );
    }

    private static double percent(long done, long total) {
        if (total <= 0) {
            return 100.0d;
        }
        return Math.round(done * 10_000.0d / total) / 100.0d;
    }

    private static final class LiveExecution {
        private final Supplier<CheckpointPayload> cursors;
        private final long startedAtMs;
        private final long producedAtStart;
        private final Map<EntityType, Double> rates = Collections.synchronizedMap(new EnumMap<>(EntityType.class));

        private LiveExecution(Supplier<CheckpointPayload> cursors, long startedAtMs, long producedAtStart) {
            this.cursors = cursors;
            this.startedAtMs = startedAtMs;
            this.producedAtStart = producedAtStart;
        }
    }
}
