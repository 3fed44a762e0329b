package io.bankseed.storage;

import io.bankseed.TestSupport;
import io.bankseed.error.ConflictException;
import io.bankseed.model.Lineage;
import io.bankseed.model.ScheduleKind;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.model.TimeWindow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

final class TaskStoreTest {
    private static final long NOW = Instant.parse("2026-03-10T05:00:00Z").toEpochMilli();

    @Test
    void onlyOneTaskPerKindCanRun() throws Exception {
        Path root = TestSupport.tempRoot("taskstore-kind");
        try {
            TaskStore store = newStore(root);
            TaskView first = store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-02T00:00:00Z"));
            TaskView second = store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-02T00:00:00Z", "2026-03-03T00:00:00Z"));
            TaskView realtime = store.insertTask(newTask(TaskKind.REALTIME, "2026-03-09T13:00:00Z", "2026-03-10T00:00:00Z"));
            Assertions.assertEquals(TaskStatus.PENDING, first.status());
            Assertions.assertEquals(0, first.attempt());

            Assertions.assertTrue(store.tryMarkRunning(first.taskId(), TaskStatus.PENDING, true, NOW));
            Assertions.assertFalse(store.tryMarkRunning(second.taskId(), TaskStatus.PENDING, true, NOW));
            Assertions.assertTrue(store.tryMarkRunning(realtime.taskId(), TaskStatus.PENDING, true, NOW));
            Assertions.assertEquals(1, store.countRunning(TaskKind.HISTORICAL));
            Assertions.assertEquals(1, store.getTask(first.taskId()).orElseThrow().attempt());

            Assertions.assertThrows(ConflictException.class,
                    () -> store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-04T00:00:00Z", "2026-03-05T00:00:00Z")));

            Assertions.assertTrue(store.markCompleted(first.taskId(), 123L, NOW + 1));
            Assertions.assertTrue(store.tryMarkRunning(second.taskId(), TaskStatus.PENDING, true, NOW + 2));
            TaskView done = store.getTask(first.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, done.status());
            Assertions.assertEquals("done", done.currentStage());
            Assertions.assertEquals(Long.valueOf(123L), store.lastSuccessfulHorizon(TaskKind.HISTORICAL).orElseThrow());
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void transitionsAreConditionalOnSourceStatus() throws Exception {
        Path root = TestSupport.tempRoot("taskstore-transitions");
        try {
            TaskStore store = newStore(root);
            TaskView task = store.insertTask(newTask(TaskKind.REALTIME, "2026-03-09T13:00:00Z", "2026-03-10T00:00:00Z"));
            String id = task.taskId();

            Assertions.assertFalse(store.markPaused(id, NOW));
            Assertions.assertFalse(store.requestControl(id, TaskStore.CONTROL_PAUSE, NOW));
            Assertions.assertTrue(store.tryMarkRunning(id, TaskStatus.PENDING, true, NOW));
            Assertions.assertTrue(store.requestControl(id, TaskStore.CONTROL_PAUSE, NOW));
            Assertions.assertEquals(TaskStore.CONTROL_PAUSE, store.getTask(id).orElseThrow().controlRequest());
            Assertions.assertTrue(store.markPaused(id, NOW));
            Assertions.assertNull(store.getTask(id).orElseThrow().controlRequest());

            Assertions.assertTrue(store.tryMarkRunning(id, TaskStatus.PAUSED, false, NOW));
            Assertions.assertEquals(1, store.getTask(id).orElseThrow().attempt());

            Assertions.assertTrue(store.markFailed(id, "boom", false, NOW));
            Assertions.assertTrue(store.scheduleRetry(id, NOW + 500, NOW));
            TaskView retrying = store.getTask(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, retrying.status());
            Assertions.assertEquals(Long.valueOf(NOW + 500), retrying.nextScheduledAtMs());
            Assertions.assertEquals(List.of(id), store.listScheduledRetries().stream().map(TaskView::taskId).toList());

            Assertions.assertTrue(store.markCancelled(id, "operator", NOW));
            Assertions.assertFalse(store.markCancelled(id, "again", NOW));
            TaskView cancelled = store.getTask(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.CANCELLED, cancelled.status());
            Assertions.assertNull(cancelled.nextScheduledAtMs());
            Assertions.assertTrue(cancelled.status().isTerminal());
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void orphanedRunningTasksReturnToPendingAndGiveBackTheAttempt() throws Exception {
        Path root = TestSupport.tempRoot("taskstore-orphans");
        try {
            TaskStore store = newStore(root);
            TaskView task = store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-02T00:00:00Z"));
            Assertions.assertTrue(store.tryMarkRunning(task.taskId(), TaskStatus.PENDING, true, NOW));

            List<String> reset = store.resetOrphanedRunning(NOW + 10);
            Assertions.assertEquals(List.of(task.taskId()), reset);
            TaskView after = store.getTask(task.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, after.status());
            Assertions.assertEquals(0, after.attempt());
            Assertions.assertTrue(store.resetOrphanedRunning(NOW + 20).isEmpty());
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void horizonQueriesOnlyCountCompletedTasks() throws Exception {
        Path root = TestSupport.tempRoot("taskstore-horizon");
        try {
            TaskStore store = newStore(root);
            TaskView early = store.insertTask(newTask(TaskKind.REALTIME, "2026-03-08T13:00:00Z", "2026-03-09T00:00:00Z"));
            TaskView failed = store.insertTask(newTask(TaskKind.REALTIME, "2026-03-09T00:00:00Z", "2026-03-09T13:00:00Z"));
            TaskView late = store.insertTask(newTask(TaskKind.REALTIME, "2026-03-09T13:00:00Z", "2026-03-10T00:00:00Z"));
            Assertions.assertTrue(store.firstSuccessfulHorizon(TaskKind.REALTIME).isEmpty());

            Assertions.assertTrue(store.tryMarkRunning(failed.taskId(), TaskStatus.PENDING, true, NOW));
            Assertions.assertTrue(store.markFailed(failed.taskId(), "boom", true, NOW));
            Assertions.assertTrue(store.getTask(failed.taskId()).orElseThrow().needsAttention());
            for (TaskView task : List.of(early, late)) {
                Assertions.assertTrue(store.tryMarkRunning(task.taskId(), TaskStatus.PENDING, true, NOW));
                Assertions.assertTrue(store.markCompleted(task.taskId(), task.dataHorizonMs(), NOW));
            }

            Assertions.assertEquals(Long.valueOf(early.dataHorizonMs()), store.firstSuccessfulHorizon(TaskKind.REALTIME).orElseThrow());
            Assertions.assertEquals(Long.valueOf(late.dataHorizonMs()), store.lastSuccessfulHorizon(TaskKind.REALTIME).orElseThrow());
            Assertions.assertTrue(store.lastSuccessfulHorizon(TaskKind.HISTORICAL).isEmpty());

            long since = Instant.parse("2026-03-09T00:00:00Z").toEpochMilli();
            List<String> ending = store.listEndingAfter(TaskKind.REALTIME, since).stream().map(TaskView::taskId).toList();
            Assertions.assertEquals(2, ending.size());
            Assertions.assertTrue(ending.containsAll(List.of(failed.taskId(), late.taskId())));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void latestTaskAndLineageListing() throws Exception {
        Path root = TestSupport.tempRoot("taskstore-lineage");
        try {
            TaskStore store = newStore(root);
            Assertions.assertTrue(store.latestTask(TaskKind.HISTORICAL).isEmpty());
            TaskView first = store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-05T00:00:00Z"));
            TaskView second = store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-05T00:00:00Z"));
            TaskView other = store.insertTask(newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-06T00:00:00Z"));

            Assertions.assertEquals(other.taskId(), store.latestTask(TaskKind.HISTORICAL).orElseThrow().taskId());
            Assertions.assertTrue(store.latestTask(TaskKind.REALTIME).isEmpty());
            Assertions.assertEquals(List.of(first.taskId(), second.taskId()),
                    store.listLineage(first.lineageKey()).stream().map(TaskView::taskId).toList());
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void schemaMigrationsAreRecordedOnce() throws Exception {
        Path root = TestSupport.tempRoot("taskstore-migrations");
        try {
            Database db = new Database(TestSupport.config(root), 5_000L);
            db.init();
            db.init();
            List<Database.SchemaMigrationRow> rows = db.listSchemaMigrations();
            Assertions.assertEquals(2, rows.size());

            Set<String> columns = new HashSet<>();
            try (Connection c = db.openConnection();
                 Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA table_info(gen_tasks)")) {
                while (rs.next()) {
                    columns.add(rs.getString("name"));
                }
            }
            Assertions.assertTrue(columns.containsAll(List.of("needs_attention", "control_request", "lineage_key")));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    static TaskStore newStore(Path root) {
        Database db = new Database(TestSupport.config(root), 5_000L);
        db.init();
        return new TaskStore(db);
    }

    static TaskStore.NewTask newTask(TaskKind kind, String start, String end) {
        TimeWindow window = TimeWindow.of(Instant.parse(start), Instant.parse(end));
        return new TaskStore.NewTask(
                UUID.randomUUID().toString(),
                kind,
                ScheduleKind.MANUAL,
                Lineage.key(kind, window),
                Lineage.tag(kind, window),
                window,
                window.endMs(),
                NOW
        );
    }
}
