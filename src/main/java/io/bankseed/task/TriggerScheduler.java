package io.bankseed.task;

import io.bankseed.config.CatchUpPolicy;
import io.bankseed.error.ConflictException;
import io.bankseed.model.ScheduleKind;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.model.TimeWindow;
import io.bankseed.storage.TaskStore;
import io.bankseed.time.TimeRuleEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Timer that turns trigger instants into realtime tasks. Each tick works out which elapsed
 * triggers have no successful or in-flight task; an on-time single trigger becomes a
 * fixed-time task and anything else a catch-up task.
 */
public final class TriggerScheduler implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TriggerScheduler.class);

    private final TaskManager taskManager;
    private final TaskStore taskStore;
    private final TimeRuleEngine timeRules;
    private final CatchUpPolicy catchUpPolicy;
    private final Clock clock;
    private final Deque<List<Instant>> queued = new ArrayDeque<>();
    private ScheduledExecutorService timer;

    public TriggerScheduler(TaskManager taskManager) {
        GenerationContext context = taskManager.context();
        this.taskManager = taskManager;
        this.taskStore = context.taskStore();
        this.timeRules = context.timeRules();
        this.catchUpPolicy = context.settings().catchUpPolicy();
        this.clock = context.clock();
        taskManager.addSettledListener(this::onSettled);
    }

    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bankseed-trigger");
            t.setDaemon(true);
            return t;
        });
        timer.execute(() -> tick(null));
        scheduleNext();
    }

    private synchronized void scheduleNext() {
        if (timer == null || timer.isShutdown()) {
            return;
        }
        Instant now = clock.instant();
        Instant next = timeRules.nextTrigger(now);
        long delayMs = Math.max(0L, next.toEpochMilli() - now.toEpochMilli());
        logger.info("Next trigger at {} (in {} ms)", next, delayMs);
        timer.schedule(() -> {
            tick(next);
            scheduleNext();
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private void tick(Instant expected) {
        try {
            reconcile(clock.instant(), expected);
        } catch (RuntimeException e) {
            logger.error("Trigger reconciliation failed", e);
        }
    }

    /**
     * Creates and starts whatever realtime work is owed at {@code now}. {@code expected} is the
     * trigger the timer was armed for, or {@code null} for a start-up check.
     * <p>
     * A trigger is owed when it elapsed after the first successful realtime task and no
     * COMPLETED, PENDING, RUNNING or PAUSED task covers its window. The trigger group of a FAILED
     * or CANCELLED task is redone as one task over the same window, so it continues that lineage.
     *
     * @return tasks created by this call
     */
    public synchronized List<TaskView> reconcile(Instant now, Instant expected) {
        startOldestPending();
        List<List<Instant>> groups = owedGroups(now, expected);
        if (groups.isEmpty()) {
            return List.of();
        }
        ScheduleKind kind = expected != null && groups.size() == 1 && groups.get(0).equals(List.of(expected))
                ? ScheduleKind.FIXED_TIME
                : ScheduleKind.MANUAL_CATCHUP;
        if (kind == ScheduleKind.MANUAL_CATCHUP) {
            logger.warn("{} realtime window(s) owed at {}, catching up with policy {}: {}", groups.size(), now,
                    catchUpPolicy, groups);
        }
        for (int i = 1; i < groups.size(); i++) {
            queued.addLast(groups.get(i));
        }
        List<TaskView> created = new ArrayList<>();
        Optional<TaskView> first = createAndStart(kind, groups.get(0));
        if (first.isPresent()) {
            created.add(first.get());
        } else {
            queued.addFirst(groups.get(0));
        }
        return created;
    }

    private List<List<Instant>> owedGroups(Instant now, Instant expected) {
        Optional<Long> firstSuccess = taskStore.firstSuccessfulHorizon(TaskKind.REALTIME);
        List<Instant> candidates;
        if (firstSuccess.isPresent()) {
            candidates = timeRules.missedTriggers(Instant.ofEpochMilli(firstSuccess.get()), now);
        } else if (expected != null && !expected.isAfter(now)) {
            candidates = List.of(expected);
        } else {
            candidates = List.of();
        }
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<TaskView> tasks = taskStore.listEndingAfter(TaskKind.REALTIME,
                timeRules.realtimeWindow(candidates.get(0)).startMs());
        Set<Instant> owed = new LinkedHashSet<>();
        for (Instant trigger : candidates) {
            if (!isOwned(trigger, tasks)) {
                owed.add(trigger);
            }
        }
        List<List<Instant>> groups = new ArrayList<>();
        for (TaskView task : tasks) {
            if (task.status() != TaskStatus.FAILED && task.status() != TaskStatus.CANCELLED) {
                continue;
            }
            List<Instant> own = triggersOf(task);
            if (!own.isEmpty() && owed.containsAll(own)) {
                groups.add(own);
                owed.removeAll(own);
            }
        }
        List<Instant> run = new ArrayList<>();
        for (Instant trigger : owed) {
            boolean contiguous = !run.isEmpty() && timeRules.nextTrigger(run.get(run.size() - 1)).equals(trigger);
            if (!run.isEmpty() && (catchUpPolicy == CatchUpPolicy.SEQUENTIAL || !contiguous)) {
                groups.add(run);
                run = new ArrayList<>();
            }
            run.add(trigger);
        }
        if (!run.isEmpty()) {
            groups.add(run);
        }
        groups.sort(Comparator.comparing((List<Instant> g) -> g.get(0)));
        return groups;
    }

    private boolean isOwned(Instant trigger, List<TaskView> tasks) {
        for (List<Instant> group : queued) {
            if (group.contains(trigger)) {
                return true;
            }
        }
        TimeWindow window = timeRules.realtimeWindow(trigger);
        for (TaskView task : tasks) {
            boolean holds = task.status() != TaskStatus.FAILED && task.status() != TaskStatus.CANCELLED;
            if (holds && task.windowStartMs() <= window.startMs() && window.endMs() <= task.windowEndMs()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Consecutive triggers whose windows make up the task's window, or empty when the window
     * was not built from triggers.
     */
    private List<Instant> triggersOf(TaskView task) {
        Instant last = Instant.ofEpochMilli(task.dataHorizonMs());
        if (!timeRules.isTrigger(last)) {
            return List.of();
        }
        Deque<Instant> triggers = new ArrayDeque<>();
        Instant t = last;
        while (timeRules.realtimeWindow(t).startMs() >= task.windowStartMs()) {
            triggers.addFirst(t);
            t = timeRules.previousTrigger(t.minusMillis(1));
        }
        if (triggers.isEmpty()) {
            return List.of();
        }
        List<Instant> out = new ArrayList<>(triggers);
        return timeRules.realtimeWindow(out).equals(task.window()) ? out : List.of();
    }

    private Optional<TaskView> createAndStart(ScheduleKind kind, List<Instant> triggers) {
        TaskView task;
        try {
            task = taskManager.createRealtimeTask(kind, triggers);
        } catch (ConflictException e) {
            logger.info("Realtime task for {} deferred: {}", triggers, e.getMessage());
            return Optional.empty();
        }
        try {
            taskManager.startTask(task.taskId());
        } catch (ConflictException e) {
            logger.info("Realtime task {} created but not started: {}", task.taskId(), e.getMessage());
        }
        return Optional.of(task);
    }

    private void startOldestPending() {
        taskStore.listTasks(TaskStatus.PENDING, 500).stream()
                .filter(t -> t.kind() == TaskKind.REALTIME && t.nextScheduledAtMs() == null)
                .min(Comparator.comparingLong(TaskView::dataHorizonMs))
                .ifPresent(t -> {
                    try {
                        taskManager.startTask(t.taskId());
                    } catch (ConflictException | IllegalStateException e) {
                        logger.debug("Pending realtime task {} not started: {}", t.taskId(), e.getMessage());
                    }
                });
    }

    private synchronized void onSettled(TaskView task) {
        if (task.kind() != TaskKind.REALTIME || queued.isEmpty()) {
            return;
        }
        if (task.status() == TaskStatus.RUNNING || task.status() == TaskStatus.PENDING) {
            return;
        }
        List<Instant> next = queued.pollFirst();
        logger.info("Sequential catch-up continuing with trigger {}", next);
        if (createAndStart(ScheduleKind.MANUAL_CATCHUP, next).isEmpty()) {
            queued.addFirst(next);
        }
    }

    public synchronized int queuedTriggers() {
        return queued.size();
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}
