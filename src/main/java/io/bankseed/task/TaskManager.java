package io.bankseed.task;

import io.bankseed.error.BankSeedException;
import io.bankseed.error.ConflictException;
import io.bankseed.error.IntegrityException;
import io.bankseed.model.Lineage;
import io.bankseed.model.ScheduleKind;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.model.TimeWindow;
import io.bankseed.observability.TransitionAuditLog;
import io.bankseed.orchestrator.ExecutionControl;
import io.bankseed.orchestrator.ExecutionOutcome;
import io.bankseed.storage.TaskStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the task lifecycle. All status changes go through here and are persisted before any
 * in-memory effect; executions run on a dedicated executor and retries are armed on a
 * scheduler.
 */
public final class TaskManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TaskManager.class);
    private static final long SETTLE_POLL_MS = 20L;

    private final GenerationContext context;
    private final TaskStore taskStore;
    private final TransitionAuditLog audit;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final ExecutorService executor;
    private final ScheduledExecutorService retryScheduler;
    private final Map<String, ReentrantLock> lineageLocks = new ConcurrentHashMap<>();
    private final Map<String, ActiveExecution> activeByLineage = new ConcurrentHashMap<>();
    private final Map<String, ActiveExecution> activeByTask = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> armedRetries = new ConcurrentHashMap<>();
    private final List<Consumer<TaskView>> settledListeners = new CopyOnWriteArrayList<>();

    public TaskManager(GenerationContext context) {
        this.context = context;
        this.taskStore = context.taskStore();
        this.audit = context.auditLog();
        this.retryPolicy = RetryPolicy.fromSettings(context.settings());
        this.clock = context.clock();
        this.executor = Executors.newCachedThreadPool(named("bankseed-task"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(named("bankseed-retry"));
    }

    public GenerationContext context() {
        return context;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public TaskView createTask(TaskKind kind, ScheduleKind scheduleKind, TimeWindow window, long dataHorizonMs) {
        long nowMs = clock.millis();
        TaskView created = taskStore.insertTask(new TaskStore.NewTask(
                UUID.randomUUID().toString(),
                kind,
                scheduleKind,
                Lineage.key(kind, window),
                Lineage.tag(kind, window),
                window,
                dataHorizonMs,
                nowMs
        ));
        audit.log("task.created", created.taskId(), "ok", details(
                "kind", kind.key(),
                "schedule_kind", scheduleKind.name(),
                "lineage_key", created.lineageKey(),
                "data_horizon_ms", dataHorizonMs
        ));
        logger.info("Created {} task {} ({}) for window {}", kind.key(), created.taskId(), scheduleKind, window);
        return created;
    }

    /**
     * Historical task over {@code [start, today)}; its horizon is the end of the window.
     * <p>
     * While the newest historical task has not completed, the new task takes over its window
     * and therefore its lineage, so the stream resumes from the last checkpoint instead of
     * starting a second population. PENDING or PAUSED tasks left on that lineage are cancelled
     * as superseded.
     */
    public TaskView createHistoricalTask(ScheduleKind scheduleKind) {
        Optional<TaskView> unfinished = taskStore.latestTask(TaskKind.HISTORICAL)
                .filter(t -> t.status() != TaskStatus.COMPLETED);
        TimeWindow window = unfinished
                .map(TaskView::window)
                .orElseGet(() -> context.timeRules().historicalWindow(context.settings(), clock.instant()));
        TaskView created = createTask(TaskKind.HISTORICAL, scheduleKind, window, window.endMs());
        if (unfinished.isPresent()) {
            logger.info("Historical task {} continues lineage {} left by task {} ({})", created.taskId(),
                    created.lineageKey(), unfinished.get().taskId(), unfinished.get().status());
            supersede(created);
        }
        return created;
    }

    private void supersede(TaskView successor) {
        for (TaskView task : taskStore.listLineage(successor.lineageKey())) {
            boolean live = task.status() == TaskStatus.PENDING || task.status() == TaskStatus.PAUSED;
            if (!live || task.taskId().equals(successor.taskId())) {
                continue;
            }
            try {
                cancelTask(task.taskId(), "superseded by task " + successor.taskId());
            } catch (IllegalStateException e) {
                logger.info("Task {} not superseded: {}", task.taskId(), e.getMessage());
            }
        }
    }

    /**
     * Realtime task covering the given consecutive triggers; its horizon is the last trigger.
     */
    public TaskView createRealtimeTask(ScheduleKind scheduleKind, List<Instant> triggers) {
        TimeWindow window = context.timeRules().realtimeWindow(triggers);
        return createTask(TaskKind.REALTIME, scheduleKind, window, triggers.get(triggers.size() - 1).toEpochMilli());
    }

    public TaskView startTask(String taskId) {
        return launch(taskId, TaskStatus.PENDING, true);
    }

    public TaskView resumeTask(String taskId) {
        return launch(taskId, TaskStatus.PAUSED, false);
    }

    private TaskView launch(String taskId, TaskStatus expected, boolean countAttempt) {
        TaskView task = require(taskId);
        ReentrantLock lock = lineageLocks.computeIfAbsent(task.lineageKey(), k -> new ReentrantLock());
        lock.lock();
        try {
            ActiveExecution inFlight = activeByLineage.get(task.lineageKey());
            if (inFlight != null) {
                throw new ConflictException("Lineage " + task.lineageKey() + " is still executing task " + inFlight.taskId());
            }
            if (task.status() != expected) {
                throw new IllegalStateException("Task " + taskId + " is " + task.status() + ", expected " + expected);
            }
            long nowMs = clock.millis();
            if (!taskStore.tryMarkRunning(taskId, expected, countAttempt, nowMs)) {
                TaskView current = require(taskId);
                if (current.status() == expected && taskStore.countRunning(current.kind()) > 0) {
                    throw new ConflictException("A " + current.kind().key() + " task is already running");
                }
                throw new IllegalStateException("Task " + taskId + " changed to " + current.status());
            }
            TaskView running = require(taskId);
            String action = expected == TaskStatus.PAUSED ? "task.resumed" : "task.started";
            try {
                audit.log(action, taskId, "ok", details(
                        "attempt", running.attempt(),
                        "lineage_key", running.lineageKey()
                ));
            } catch (RuntimeException e) {
                // The row is already RUNNING; it needs an execution whether or not the audit row landed.
                logger.error("Audit of {} for task {} failed", action, taskId, e);
            }
            ExecutionControl control = new ExecutionControl(taskId, taskStore, context.settings().controlPollMs(), clock);
            ActiveExecution active = new ActiveExecution(taskId, running.lineageKey(), control);
            activeByLineage.put(running.lineageKey(), active);
            activeByTask.put(taskId, active);
            disarmRetry(taskId);
            try {
                executor.execute(() -> execute(running, active));
            } catch (RuntimeException e) {
                activeByLineage.remove(running.lineageKey(), active);
                activeByTask.remove(taskId, active);
                throw e;
            }
            logger.info("Task {} {} (attempt {})", taskId, expected == TaskStatus.PAUSED ? "resumed" : "started", running.attempt());
            return running;
        } finally {
            lock.unlock();
        }
    }

    private void execute(TaskView task, ActiveExecution active) {
        String taskId = task.taskId();
        try {
            ExecutionOutcome outcome = context.orchestrator().run(task, active.control(),
                    stage -> taskStore.updateStage(taskId, stage, clock.millis()));
            finish(task, outcome);
        } catch (RuntimeException e) {
            handleFailure(task, e);
        } finally {
            activeByLineage.remove(task.lineageKey(), active);
            activeByTask.remove(taskId, active);
            notifySettled(taskId);
        }
    }

    private void finish(TaskView task, ExecutionOutcome outcome) {
        long nowMs = clock.millis();
        String taskId = task.taskId();
        switch (outcome) {
            case COMPLETED -> {
                if (taskStore.markCompleted(taskId, task.dataHorizonMs(), nowMs)) {
                    audit.log("task.completed", taskId, "ok", details("data_horizon_ms", task.dataHorizonMs()));
                    logger.info("Task {} completed", taskId);
                } else {
                    logger.warn("Task {} finished but was no longer RUNNING; status left unchanged", taskId);
                }
            }
            case PAUSED -> {
                if (taskStore.markPaused(taskId, nowMs)) {
                    audit.log("task.paused", taskId, "ok", Map.of());
                    logger.info("Task {} paused", taskId);
                } else {
                    logger.warn("Task {} stopped for pause but was no longer RUNNING", taskId);
                }
            }
            case CANCELLED -> {
                if (taskStore.markCancelled(taskId, "cancelled", nowMs)) {
                    audit.log("task.cancelled", taskId, "ok", details("during", "execution"));
                }
                logger.info("Task {} stopped after cancellation", taskId);
            }
        }
    }

    private void handleFailure(TaskView task, RuntimeException failure) {
        String taskId = task.taskId();
        long nowMs = clock.millis();
        TaskView current = require(taskId);
        if (current.status() != TaskStatus.RUNNING) {
            logger.warn("Task {} failed after leaving RUNNING ({}): {}", taskId, current.status(), failure.getMessage());
            return;
        }
        String error = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        boolean retryable = !(failure instanceof IntegrityException) && !(failure instanceof ConflictException);
        boolean willRetry = retryable && retryPolicy.canRetry(current.attempt());
        taskStore.markFailed(taskId, error, !willRetry, nowMs);
        audit.log("task.failed", taskId, "error", details(
                "attempt", current.attempt(),
                "error", error,
                "retryable", retryable
        ));
        if (willRetry) {
            long delayMs = retryPolicy.delayMs(current.attempt());
            long nextAtMs = nowMs + delayMs;
            taskStore.scheduleRetry(taskId, nextAtMs, nowMs);
            audit.log("task.retry.scheduled", taskId, "ok", details(
                    "attempt", current.attempt(),
                    "delay_ms", delayMs,
                    "next_scheduled_at_ms", nextAtMs
            ));
            logger.warn("Task {} failed on attempt {}/{}, retrying in {} ms: {}", taskId, current.attempt(),
                    retryPolicy.maxAttempts(), delayMs, error);
            arm(taskId, delayMs);
        } else if (retryable) {
            audit.log("task.retry.exhausted", taskId, "error", details(
                    "attempts", current.attempt(),
                    "error", error
            ));
            logger.error("Task {} exhausted {} attempts and needs attention: {}", taskId, current.attempt(), error, failure);
        } else {
            logger.error("Task {} failed permanently and needs attention: {}", taskId, error, failure);
        }
    }

    private void arm(String taskId, long delayMs) {
        ScheduledFuture<?> future = retryScheduler.schedule(() -> fireRetry(taskId), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = armedRetries.put(taskId, future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void disarmRetry(String taskId) {
        ScheduledFuture<?> armed = armedRetries.remove(taskId);
        if (armed != null) {
            armed.cancel(false);
        }
    }

    private void fireRetry(String taskId) {
        try {
            startTask(taskId);
        } catch (ConflictException e) {
            long delayMs = retryPolicy.baseBackoffMs();
            logger.info("Retry of task {} deferred {} ms: {}", taskId, delayMs, e.getMessage());
            arm(taskId, delayMs);
        } catch (IllegalStateException | NoSuchElementException e) {
            armedRetries.remove(taskId);
            logger.info("Retry of task {} dropped: {}", taskId, e.getMessage());
            notifySettled(taskId);
        } catch (RuntimeException e) {
            armedRetries.remove(taskId);
            logger.error("Retry of task {} could not start", taskId, e);
            notifySettled(taskId);
        }
    }

    /**
     * Asks a RUNNING task to stop at its next batch boundary. The request is stored on the task
     * row so an execution in another process sees it too.
     */
    public void pauseTask(String taskId) {
        TaskView task = require(taskId);
        if (task.status() != TaskStatus.RUNNING) {
            throw new IllegalStateException("Only RUNNING tasks can be paused; task " + taskId + " is " + task.status());
        }
        if (!taskStore.requestControl(taskId, TaskStore.CONTROL_PAUSE, clock.millis())) {
            throw new IllegalStateException("Task " + taskId + " left RUNNING before the pause was recorded");
        }
        ActiveExecution active = activeByTask.get(taskId);
        if (active != null) {
            active.control().requestPause();
        }
        audit.log("task.pause.requested", taskId, "ok", Map.of());
        logger.info("Pause requested for task {}", taskId);
    }

    /**
     * Marks the task CANCELLED right away. A running execution finishes its current batch,
     * checkpoints and stops; records already written stay.
     */
    public void cancelTask(String taskId, String reason) {
        TaskView task = require(taskId);
        String why = reason == null || reason.isBlank() ? "cancelled by operator" : reason.trim();
        if (!taskStore.markCancelled(taskId, why, clock.millis())) {
            throw new IllegalStateException("Task " + taskId + " cannot be cancelled from " + require(taskId).status());
        }
        disarmRetry(taskId);
        ActiveExecution active = activeByTask.get(taskId);
        if (active != null) {
            active.control().requestCancel();
        }
        audit.log("task.cancelled", taskId, "ok", details("from", task.status().name(), "reason", why));
        logger.info("Task {} cancelled from {}", taskId, task.status());
        if (active == null) {
            notifySettled(taskId);
        }
    }

    public TaskStatusView queryStatus(String taskId) {
        TaskView task = require(taskId);
        return new TaskStatusView(
                task,
                context.progressTracker().snapshot(taskId),
                context.validationRecorder().warnings(taskId)
        );
    }

    public List<TaskView> listTasks(TaskStatus status, int limit) {
        return taskStore.listTasks(status, limit);
    }

    /**
     * Start-up reconciliation: RUNNING rows with no live execution are returned to PENDING and
     * persisted retries are re-armed.
     */
    public RecoveryReport recover() {
        long nowMs = clock.millis();
        List<String> orphans = new ArrayList<>();
        for (String taskId : taskStore.resetOrphanedRunning(nowMs)) {
            if (activeByTask.containsKey(taskId)) {
                continue;
            }
            orphans.add(taskId);
            audit.log("task.recovered", taskId, "ok", details("from", TaskStatus.RUNNING.name(), "to", TaskStatus.PENDING.name()));
        }
        List<String> rearmed = new ArrayList<>();
        for (TaskView retry : taskStore.listScheduledRetries()) {
            if (armedRetries.containsKey(retry.taskId())) {
                continue;
            }
            long delayMs = Math.max(0L, retry.nextScheduledAtMs() - nowMs);
            arm(retry.taskId(), delayMs);
            rearmed.add(retry.taskId());
        }
        if (!orphans.isEmpty() || !rearmed.isEmpty()) {
            logger.info("Recovery reset {} orphaned tasks and re-armed {} retries", orphans.size(), rearmed.size());
        }
        return new RecoveryReport(orphans, rearmed);
    }

    public boolean isExecuting(String taskId) {
        return activeByTask.containsKey(taskId);
    }

    public boolean isRetryArmed(String taskId) {
        return armedRetries.containsKey(taskId);
    }

    /**
     * Waits until the task has no execution in flight and no retry armed.
     */
    public TaskView awaitSettled(String taskId, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            boolean busyBefore = isBusy(taskId);
            TaskView task = require(taskId);
            if (!busyBefore && !isBusy(taskId) && task.status() != TaskStatus.RUNNING) {
                return task;
            }
            if (System.nanoTime() >= deadline) {
                throw new BankSeedException("Timed out waiting for task " + taskId + " to settle (status " + task.status() + ")");
            }
            try {
                Thread.sleep(SETTLE_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BankSeedException("Interrupted waiting for task " + taskId, e);
            }
        }
    }

    private boolean isBusy(String taskId) {
        return activeByTask.containsKey(taskId) || armedRetries.containsKey(taskId);
    }

    /**
     * Called with the task row each time an execution ends or a pending task is settled without
     * running.
     */
    public void addSettledListener(Consumer<TaskView> listener) {
        settledListeners.add(listener);
    }

    private void notifySettled(String taskId) {
        if (settledListeners.isEmpty()) {
            return;
        }
        TaskView task = taskStore.getTask(taskId).orElse(null);
        if (task == null) {
            return;
        }
        for (Consumer<TaskView> listener : settledListeners) {
            try {
                listener.accept(task);
            } catch (RuntimeException e) {
                logger.error("Settled listener failed for task {}", taskId, e);
            }
        }
    }

    private TaskView require(String taskId) {
        return taskStore.getTask(taskId).orElseThrow(() -> new NoSuchElementException("Task not found: " + taskId));
    }

    @Override
    public void close() {
        for (ActiveExecution active : activeByTask.values()) {
            active.control().requestPause();
        }
        retryScheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Task executions still running at shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static Map<String, Object> details(Object... kv) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            out.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return out;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record ActiveExecution(String taskId, String lineageKey, ExecutionControl control) {
    }

    public record RecoveryReport(List<String> resetTaskIds, List<String> rearmedRetryIds) {
    }
}
