package io.bankseed.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.bankseed.config.BankSeedConfig;
import io.bankseed.error.ConflictException;
import io.bankseed.model.Checkpoint;
import io.bankseed.model.ScheduleKind;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskStatus;
import io.bankseed.model.TaskView;
import io.bankseed.observability.TransitionAuditLog;
import io.bankseed.storage.Database;
import io.bankseed.task.GenerationContext;
import io.bankseed.task.TaskManager;
import io.bankseed.task.TriggerScheduler;
import io.bankseed.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "bankseed",
        mixinStandardHelpOptions = true,
        description = "BankSeed synthetic banking data generator",
        subcommands = {
                BankSeedCommand.InitCommand.class,
                BankSeedCommand.CreateCommand.class,
                BankSeedCommand.StartCommand.class,
                BankSeedCommand.PauseCommand.class,
                BankSeedCommand.ResumeCommand.class,
                BankSeedCommand.CancelCommand.class,
                BankSeedCommand.StatusCommand.class,
                BankSeedCommand.TasksCommand.class,
                BankSeedCommand.CheckpointsCommand.class,
                BankSeedCommand.ValidationCommand.class,
                BankSeedCommand.RecoverCommand.class,
                BankSeedCommand.ScheduleCommand.class,
                BankSeedCommand.AuditTailCommand.class,
                BankSeedCommand.AuditVerifyCommand.class,
                BankSeedCommand.SchemaMigrationsCommand.class
        }
)
public final class BankSeedCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | start | pause | resume | cancel | status | tasks | checkpoints | validation | recover | schedule | audit-tail | audit-verify | schema-migrations");
    }

    BankSeedConfig config() {
        return BankSeedConfig.fromRoot(root);
    }

    GenerationContext context() {
        return GenerationContext.open(config());
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        return out;
    }

    /**
     * Runs a task-level action and maps the expected failures to a JSON error and exit code 1.
     */
    private static Integer guarded(Callable<Integer> action) throws Exception {
        try {
            return action.call();
        } catch (NoSuchElementException | IllegalStateException | IllegalArgumentException | ConflictException e) {
            System.out.println(Jsons.toJson(error(e.getMessage())));
            return 1;
        }
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Override
        public Integer call() {
            GenerationContext context = parent.context();
            System.out.println("Initialized BankSeed at: " + context.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create", description = "Create a historical or realtime generation task")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Option(names = {"--kind"}, required = true, description = "Task kind: historical|realtime")
        String kind;

        @Option(names = {"--trigger"}, description = "Realtime trigger instant (ISO-8601); repeat for a catch-up window")
        List<String> triggers = new ArrayList<>();

        @Option(names = {"--start"}, description = "Start the task right after creating it")
        boolean start;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (TaskManager manager = new TaskManager(parent.context())) {
                    TaskView task;
                    if (TaskKind.fromString(kind) == TaskKind.HISTORICAL) {
                        task = manager.createHistoricalTask(ScheduleKind.MANUAL);
                    } else {
                        List<Instant> parsed = parseTriggers(manager);
                        ScheduleKind scheduleKind = parsed.size() > 1 ? ScheduleKind.MANUAL_CATCHUP : ScheduleKind.MANUAL;
                        task = manager.createRealtimeTask(scheduleKind, parsed);
                    }
                    if (start) {
                        manager.startTask(task.taskId());
                        task = manager.awaitSettled(task.taskId(), Duration.ofDays(1));
                    }
                    System.out.println(Jsons.toJson(task));
                    return 0;
                }
            });
        }

        private List<Instant> parseTriggers(TaskManager manager) {
            if (triggers.isEmpty()) {
                Instant now = manager.context().clock().instant();
                return List.of(manager.context().timeRules().previousTrigger(now));
            }
            List<Instant> out = new ArrayList<>();
            for (String raw : triggers) {
                try {
                    out.add(Instant.parse(raw.trim()));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Invalid trigger instant: " + raw, e);
                }
            }
            return out;
        }
    }

    @Command(name = "start", description = "Start a PENDING task and wait for it to settle")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--wait-seconds"}, defaultValue = "86400", description = "Maximum seconds to wait")
        long waitSeconds;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (TaskManager manager = new TaskManager(parent.context())) {
                    manager.startTask(taskId);
                    TaskView settled = manager.awaitSettled(taskId, Duration.ofSeconds(waitSeconds));
                    System.out.println(Jsons.toJson(settled));
                    return settled.status() == TaskStatus.COMPLETED ? 0 : 1;
                }
            });
        }
    }

    @Command(name = "pause", description = "Request a pause of a RUNNING task")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (TaskManager manager = new TaskManager(parent.context())) {
                    manager.pauseTask(taskId);
                    System.out.println(Jsons.toJson(manager.queryStatus(taskId).task()));
                    return 0;
                }
            });
        }
    }

    @Command(name = "resume", description = "Resume a PAUSED task from its latest checkpoint")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--wait-seconds"}, defaultValue = "86400", description = "Maximum seconds to wait")
        long waitSeconds;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (TaskManager manager = new TaskManager(parent.context())) {
                    manager.resumeTask(taskId);
                    TaskView settled = manager.awaitSettled(taskId, Duration.ofSeconds(waitSeconds));
                    System.out.println(Jsons.toJson(settled));
                    return settled.status() == TaskStatus.COMPLETED ? 0 : 1;
                }
            });
        }
    }

    @Command(name = "cancel", description = "Cancel a pending, running or paused task")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--reason"}, description = "Cancellation reason")
        String reason;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (TaskManager manager = new TaskManager(parent.context())) {
                    manager.cancelTask(taskId, reason);
                    System.out.println(Jsons.toJson(manager.queryStatus(taskId).task()));
                    return 0;
                }
            });
        }
    }

    @Command(name = "status", description = "Show task status, progress and validation warnings")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (TaskManager manager = new TaskManager(parent.context())) {
                    System.out.println(Jsons.toJson(manager.queryStatus(taskId)));
                    return 0;
                }
            });
        }
    }

    @Command(name = "tasks", description = "List tasks, newest first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                GenerationContext context = parent.context();
                TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.fromString(status);
                System.out.println(Jsons.toJson(context.taskStore().listTasks(filter, limit)));
                return 0;
            });
        }
    }

    @Command(name = "checkpoints", description = "List checkpoints of a lineage, newest first")
    static final class CheckpointsCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Option(names = {"--task"}, description = "Task id whose lineage to list")
        String taskId;

        @Option(names = {"--lineage"}, description = "Lineage key")
        String lineage;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                GenerationContext context = parent.context();
                String lineageKey = lineage;
                if (lineageKey == null || lineageKey.isBlank()) {
                    if (taskId == null || taskId.isBlank()) {
                        throw new IllegalArgumentException("Either --task or --lineage is required");
                    }
                    lineageKey = context.taskStore().getTask(taskId)
                            .map(TaskView::lineageKey)
                            .orElseThrow(() -> new NoSuchElementException("Task not found: " + taskId));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                for (Checkpoint checkpoint : context.checkpointStore().list(lineageKey, limit)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("checkpointId", checkpoint.checkpointId());
                    row.put("taskId", checkpoint.taskId());
                    row.put("lineageKey", checkpoint.lineageKey());
                    row.put("sequence", checkpoint.sequence());
                    row.put("createdAtMs", checkpoint.createdAtMs());
                    row.put("totalProduced", checkpoint.payload().totalProduced());
                    row.put("payload", Jsons.mapper().readTree(checkpoint.payload().toJson()));
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
                return 0;
            });
        }
    }

    @Command(name = "validation", description = "List stored validation results of a task")
    static final class ValidationCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            GenerationContext context = parent.context();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("results", context.validationRecorder().list(taskId, limit));
            out.put("warnings", context.validationRecorder().warnings(taskId));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "recover", description = "Return orphaned RUNNING tasks to PENDING")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Override
        public Integer call() {
            try (TaskManager manager = new TaskManager(parent.context())) {
                System.out.println(Jsons.toJson(manager.recover()));
                return 0;
            }
        }
    }

    @Command(name = "schedule", description = "Run the realtime trigger daemon until interrupted")
    static final class ScheduleCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Option(names = {"--historical"}, description = "Create and start a historical task when none has completed")
        boolean historical;

        @Override
        public Integer call() throws Exception {
            TaskManager manager = new TaskManager(parent.context());
            TriggerScheduler scheduler = new TriggerScheduler(manager);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                scheduler.close();
                manager.close();
                stopped.countDown();
            }, "bankseed-shutdown"));
            TaskManager.RecoveryReport report = manager.recover();
            System.out.println(Jsons.toJson(report));
            if (historical && manager.context().taskStore().lastSuccessfulHorizon(TaskKind.HISTORICAL).isEmpty()
                    && manager.context().taskStore().countRunning(TaskKind.HISTORICAL) == 0) {
                try {
                    TaskView task = manager.createHistoricalTask(ScheduleKind.MANUAL);
                    manager.startTask(task.taskId());
                } catch (ConflictException e) {
                    System.out.println(Jsons.toJson(error(e.getMessage())));
                }
            }
            scheduler.start();
            System.out.println("Trigger scheduler running at: " + manager.context().config().rootDir());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Option(names = {"--action"}, description = "Only rows with this action")
        String action;

        @Option(names = {"--task"}, description = "Only rows for this task id")
        String taskId;

        @Override
        public Integer call() {
            TransitionAuditLog audit = new TransitionAuditLog(parent.config().auditFile());
            List<JsonNode> rows = action == null && taskId == null
                    ? audit.tail(lines)
                    : audit.find(action, taskId);
            int from = Math.max(0, rows.size() - Math.max(1, lines));
            for (JsonNode row : rows.subList(from, rows.size())) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Override
        public Integer call() {
            TransitionAuditLog.IntegrityReport report = new TransitionAuditLog(parent.config().auditFile()).verify();
            System.out.println(Jsons.toJson(report));
            return report.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        BankSeedCommand parent;

        @Override
        public Integer call() {
            Database database = parent.context().database();
            System.out.println(Jsons.toJson(database.listSchemaMigrations()));
            return 0;
        }
    }
}
