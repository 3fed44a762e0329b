package io.bankseed.orchestrator;

import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.storage.TaskStore;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop flag for one execution, consulted between batches. Requests come from this
 * process directly or from another process through the task row, which is polled at most once
 * per poll interval. Once a signal is observed it stays set.
 */
public final class ExecutionControl {
    public enum Signal {
        NONE,
        PAUSE,
        CANCEL
    }

    private final String taskId;
    private final TaskStore taskStore;
    private final long pollIntervalMs;
    private final Clock clock;
    private final AtomicReference<Signal> signal = new AtomicReference<>(Signal.NONE);
    private long lastPollMs;

    public ExecutionControl(String taskId, TaskStore taskStore, long pollIntervalMs, Clock clock) {
        this.taskId = taskId;
        this.taskStore = taskStore;
        this.pollIntervalMs = Math.max(0L, pollIntervalMs);
        this.clock = clock;
        this.lastPollMs = Long.MIN_VALUE;
    }

    /**
     * Control that only reacts to in-process requests.
     */
    public static ExecutionControl local(String taskId) {
        return new ExecutionControl(taskId, null, 0L, Clock.systemUTC());
    }

    public String taskId() {
        return taskId;
    }

    public void requestPause() {
        signal.compareAndSet(Signal.NONE, Signal.PAUSE);
    }

    public void requestCancel() {
        signal.set(Signal.CANCEL);
    }

    public Signal check() {
        Signal current = signal.get();
        if (current != Signal.NONE || taskStore == null) {
            return current;
        }
        pollIfDue();
        return signal.get();
    }

    private synchronized void pollIfDue() {
        long now = clock.millis();
        if (lastPollMs != Long.MIN_VALUE && now - lastPollMs < pollIntervalMs) {
            return;
        }
        lastPollMs = now;
        Optional<TaskView> row = taskStore.getTask(taskId);
        if (row.isEmpty() || row.get().status() == TaskStatus.CANCELLED) {
            requestCancel();
        } else if (TaskStore.CONTROL_PAUSE.equals(row.get().controlRequest())) {
            requestPause();
        }
    }
}
