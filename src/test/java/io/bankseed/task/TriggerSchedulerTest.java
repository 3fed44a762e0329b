package io.bankseed.task;

import io.bankseed.TestSupport;
import io.bankseed.config.CatchUpPolicy;
import io.bankseed.config.GenerationSettings;
import io.bankseed.model.ScheduleKind;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.storage.TaskStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

final class TriggerSchedulerTest {
    private static final Instant NOW = Instant.parse("2026-03-10T05:00:00Z");
    private static final Duration SETTLE = Duration.ofSeconds(60);

    @Test
    void nothingIsOwedBeforeAnyRealtimeTaskExists() throws Exception {
        Path root = TestSupport.tempRoot("scheduler-empty");
        TaskManager manager = new TaskManager(context(root, CatchUpPolicy.COLLAPSE));
        try (TriggerScheduler scheduler = new TriggerScheduler(manager)) {
            Assertions.assertTrue(scheduler.reconcile(NOW, null).isEmpty());
            Assertions.assertTrue(manager.listTasks(null, 10).isEmpty());
        } finally {
            manager.close();
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void missedTriggersAreCaughtUpOnceAndOnTimeTriggersAreFixedTime() throws Exception {
        Path root = TestSupport.tempRoot("scheduler-catchup");
        TaskManager manager = new TaskManager(context(root, CatchUpPolicy.COLLAPSE));
        try (TriggerScheduler scheduler = new TriggerScheduler(manager)) {
            seedHistory(manager);
            TaskView first = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-09T13:00:00Z")));
            manager.startTask(first.taskId());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(first.taskId(), SETTLE).status());

            List<TaskView> caughtUp = scheduler.reconcile(Instant.parse("2026-03-10T02:30:00Z"), null);
            Assertions.assertEquals(1, caughtUp.size());
            TaskView catchUp = caughtUp.get(0);
            Assertions.assertEquals(ScheduleKind.MANUAL_CATCHUP, catchUp.scheduleKind());
            Assertions.assertEquals(Instant.parse("2026-03-10T01:00:00Z").toEpochMilli(), catchUp.dataHorizonMs());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(catchUp.taskId(), SETTLE).status());
            Assertions.assertTrue(scheduler.reconcile(Instant.parse("2026-03-10T02:30:00Z"), null).isEmpty());

            Instant midday = Instant.parse("2026-03-10T13:00:00Z");
            List<TaskView> onTime = scheduler.reconcile(midday, midday);
            Assertions.assertEquals(1, onTime.size());
            Assertions.assertEquals(ScheduleKind.FIXED_TIME, onTime.get(0).scheduleKind());
            Assertions.assertEquals(midday.toEpochMilli(), onTime.get(0).dataHorizonMs());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(onTime.get(0).taskId(), SETTLE).status());
            Assertions.assertTrue(scheduler.reconcile(midday, midday).isEmpty());
        } finally {
            manager.close();
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void collapsePolicyCoversAllMissedTriggersWithOneTask() throws Exception {
        Path root = TestSupport.tempRoot("scheduler-collapse");
        TaskManager manager = new TaskManager(context(root, CatchUpPolicy.COLLAPSE));
        try (TriggerScheduler scheduler = new TriggerScheduler(manager)) {
            seedHistory(manager);
            TaskView first = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-10T13:00:00Z")));
            manager.startTask(first.taskId());
            manager.awaitSettled(first.taskId(), SETTLE);

            List<TaskView> created = scheduler.reconcile(Instant.parse("2026-03-12T02:00:00Z"), null);

            Assertions.assertEquals(1, created.size());
            TaskView task = created.get(0);
            Assertions.assertEquals(ScheduleKind.MANUAL_CATCHUP, task.scheduleKind());
            Assertions.assertEquals(Instant.parse("2026-03-10T13:00:00Z").toEpochMilli(), task.windowStartMs());
            Assertions.assertEquals(Instant.parse("2026-03-12T00:00:00Z").toEpochMilli(), task.windowEndMs());
            Assertions.assertEquals(Instant.parse("2026-03-12T01:00:00Z").toEpochMilli(), task.dataHorizonMs());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(task.taskId(), SETTLE).status());
            Assertions.assertEquals(0, scheduler.queuedTriggers());
        } finally {
            manager.close();
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void sequentialPolicyRunsOneTaskPerMissedTrigger() throws Exception {
        Path root = TestSupport.tempRoot("scheduler-sequential");
        TaskManager manager = new TaskManager(context(root, CatchUpPolicy.SEQUENTIAL));
        try (TriggerScheduler scheduler = new TriggerScheduler(manager)) {
            seedHistory(manager);
            TaskView first = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-10T13:00:00Z")));
            manager.startTask(first.taskId());
            manager.awaitSettled(first.taskId(), SETTLE);

            List<TaskView> created = scheduler.reconcile(Instant.parse("2026-03-11T14:00:00Z"), null);
            Assertions.assertEquals(1, created.size());
            Assertions.assertEquals(Instant.parse("2026-03-11T01:00:00Z").toEpochMilli(), created.get(0).dataHorizonMs());

            long lastHorizon = Instant.parse("2026-03-11T13:00:00Z").toEpochMilli();
            long deadline = System.nanoTime() + SETTLE.toNanos();
            while (!coveredBy(manager, lastHorizon) && System.nanoTime() < deadline) {
                Thread.sleep(20L);
            }
            List<TaskView> realtime = manager.listTasks(null, 20).stream()
                    .filter(t -> t.kind() == TaskKind.REALTIME)
                    .toList();
            Assertions.assertEquals(3, realtime.size());
            for (TaskView task : realtime) {
                Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(task.taskId(), SETTLE).status());
            }
            Assertions.assertEquals(2, realtime.stream().filter(t -> t.scheduleKind() == ScheduleKind.MANUAL_CATCHUP).count());
            Assertions.assertEquals(0, scheduler.queuedTriggers());
        } finally {
            manager.close();
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void failedTriggerIsOwedAgainAndRedoneOnItsOwnLineage() throws Exception {
        Path root = TestSupport.tempRoot("scheduler-failed");
        TaskManager manager = new TaskManager(context(root, CatchUpPolicy.COLLAPSE));
        try (TriggerScheduler scheduler = new TriggerScheduler(manager)) {
            seedHistory(manager);
            TaskView done = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-09T01:00:00Z")));
            manager.startTask(done.taskId());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(done.taskId(), SETTLE).status());

            TaskView failed = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-09T13:00:00Z")));
            TaskStore store = manager.context().taskStore();
            long nowMs = NOW.toEpochMilli();
            Assertions.assertTrue(store.tryMarkRunning(failed.taskId(), TaskStatus.PENDING, true, nowMs));
            Assertions.assertTrue(store.markFailed(failed.taskId(), "GeneratorException: exhausted", true, nowMs));

            Instant at = Instant.parse("2026-03-10T02:30:00Z");
            List<TaskView> created = scheduler.reconcile(at, null);
            Assertions.assertEquals(1, created.size());
            TaskView redo = created.get(0);
            Assertions.assertEquals(ScheduleKind.MANUAL_CATCHUP, redo.scheduleKind());
            Assertions.assertEquals(failed.lineageKey(), redo.lineageKey());
            Assertions.assertEquals(failed.window(), redo.window());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(redo.taskId(), SETTLE).status());

            long nextHorizon = Instant.parse("2026-03-10T01:00:00Z").toEpochMilli();
            long deadline = System.nanoTime() + SETTLE.toNanos();
            while (!coveredBy(manager, nextHorizon) && System.nanoTime() < deadline) {
                Thread.sleep(20L);
            }
            TaskView next = manager.listTasks(TaskStatus.COMPLETED, 20).stream()
                    .filter(t -> t.kind() == TaskKind.REALTIME && t.dataHorizonMs() == nextHorizon)
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(ScheduleKind.MANUAL_CATCHUP, next.scheduleKind());
            Assertions.assertEquals(Instant.parse("2026-03-09T13:00:00Z").toEpochMilli(), next.windowStartMs());
            Assertions.assertEquals(0, scheduler.queuedTriggers());
            Assertions.assertTrue(scheduler.reconcile(at, null).isEmpty());
        } finally {
            manager.close();
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void cancelledTriggerIsOwedAgain() throws Exception {
        Path root = TestSupport.tempRoot("scheduler-cancelled");
        TaskManager manager = new TaskManager(context(root, CatchUpPolicy.SEQUENTIAL));
        try (TriggerScheduler scheduler = new TriggerScheduler(manager)) {
            seedHistory(manager);
            TaskView done = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-09T01:00:00Z")));
            manager.startTask(done.taskId());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(done.taskId(), SETTLE).status());
            TaskView cancelled = manager.createRealtimeTask(ScheduleKind.FIXED_TIME,
                    List.of(Instant.parse("2026-03-09T13:00:00Z")));
            manager.cancelTask(cancelled.taskId(), "operator stop");

            List<TaskView> created = scheduler.reconcile(Instant.parse("2026-03-09T14:00:00Z"), null);

            Assertions.assertEquals(1, created.size());
            Assertions.assertEquals(cancelled.lineageKey(), created.get(0).lineageKey());
            Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(created.get(0).taskId(), SETTLE).status());
            Assertions.assertTrue(scheduler.reconcile(Instant.parse("2026-03-09T14:00:00Z"), null).isEmpty());
        } finally {
            manager.close();
            TestSupport.deleteRecursively(root);
        }
    }

    private static boolean coveredBy(TaskManager manager, long horizonMs) {
        return manager.listTasks(TaskStatus.COMPLETED, 20).stream()
                .anyMatch(t -> t.kind() == TaskKind.REALTIME && t.dataHorizonMs() == horizonMs);
    }

    private static void seedHistory(TaskManager manager) {
        TaskView history = manager.createHistoricalTask(ScheduleKind.MANUAL);
        manager.startTask(history.taskId());
        Assertions.assertEquals(TaskStatus.COMPLETED, manager.awaitSettled(history.taskId(), SETTLE).status());
    }

    private static GenerationContext context(Path root, CatchUpPolicy policy) {
        GenerationSettings s = TestSupport.smallSettings(LocalDate.ofInstant(NOW, ZoneOffset.UTC));
        GenerationSettings settings = new GenerationSettings(
                s.zone(),
                s.randomSeed(),
                s.batchSize(),
                s.checkpointEveryBatches(),
                s.checkpointKeep(),
                s.historicalStartDate(),
                s.workerThreads(),
                s.maxAttempts(),
                s.baseBackoffMs(),
                s.maxBackoffMs(),
                s.batchMaxAttempts(),
                s.batchRetryDelayMs(),
                s.storageTimeoutMs(),
                s.controlPollMs(),
                policy,
                s.maxCatchUpTriggers(),
                s.defaultFailureRateThreshold(),
                s.failureRateThresholds(),
                s.fixedVolumes(),
                s.dailyVolumes()
        );
        return GenerationContext.builder(TestSupport.config(root))
                .settings(settings)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }
}
