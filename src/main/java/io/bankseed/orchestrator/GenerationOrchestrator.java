package io.bankseed.orchestrator;

import io.bankseed.config.GenerationSettings;
import io.bankseed.error.GeneratorException;
import io.bankseed.error.IntegrityException;
import io.bankseed.error.PersistenceException;
import io.bankseed.generator.EntityGenerator;
import io.bankseed.generator.GeneratedBatch;
import io.bankseed.generator.GenerationRequest;
import io.bankseed.generator.GeneratorRegistry;
import io.bankseed.generator.IdentifierRegistry;
import io.bankseed.generator.VolumePlanner;
import io.bankseed.model.Checkpoint;
import io.bankseed.model.CheckpointPayload;
import io.bankseed.model.Cursor;
import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;
import io.bankseed.model.TaskView;
import io.bankseed.progress.ProgressTracker;
import io.bankseed.storage.CheckpointStore;
import io.bankseed.storage.RecordSink;
import io.bankseed.storage.RecordSink.StoredIdentifier;
import io.bankseed.validation.RecordValidator;
import io.bankseed.validation.ValidationRecorder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one task execution: rebuilds state from the lineage checkpoint, then produces every
 * planned type stage by stage in fixed-size batches.
 *
 * <p>Per batch the order is generate, verify references, validate, persist, register,
 * publish the cursor, and periodically checkpoint. A cursor never runs ahead of what the
 * sink holds, so resuming from any checkpoint re-emits only records the idempotent sink
 * already absorbs or has not yet seen.
 */
public final class GenerationOrchestrator {
    private static final Logger logger = LogManager.getLogger(GenerationOrchestrator.class);

    private final GenerationSettings settings;
    private final GeneratorRegistry generators;
    private final RecordSink sink;
    private final CheckpointStore checkpointStore;
    private final RecordValidator validator;
    private final ValidationRecorder validationRecorder;
    private final ProgressTracker progressTracker;
    private final VolumePlanner planner;

    public GenerationOrchestrator(
            GenerationSettings settings,
            GeneratorRegistry generators,
            RecordSink sink,
            CheckpointStore checkpointStore,
            RecordValidator validator,
            ValidationRecorder validationRecorder,
            ProgressTracker progressTracker,
            VolumePlanner planner
    ) {
        this.settings = settings;
        this.generators = generators;
        this.sink = sink;
        this.checkpointStore = checkpointStore;
        this.validator = validator;
        this.validationRecorder = validationRecorder;
        this.progressTracker = progressTracker;
        this.planner = planner;
    }

    public ExecutionOutcome run(TaskView task, ExecutionControl control, Consumer<String> stageListener) {
        Map<EntityType, Long> planned = planner.plan(task.kind(), task.window());
        CheckpointPayload start = checkpointStore.latest(task.lineageKey())
                .map(Checkpoint::payload)
                .orElse(CheckpointPayload.EMPTY);
        Execution execution = new Execution(task, planned, start, control);
        logger.info("Task {} starting lineage {} with {} planned types{}", task.taskId(), task.lineageKey(),
                planned.size(), start.cursors().isEmpty() ? "" : " from checkpoint");
        rebuildRegistry(execution);
        progressTracker.begin(task.taskId(), execution.board::snapshot);
        ExecutorService pool = Executors.newFixedThreadPool(settings.workerThreads(), workerThreads(task.taskId()));
        try {
            for (StagePlan.Stage stage : StagePlan.of(planned.keySet()).stages()) {
                ExecutionControl.Signal signal = control.check();
                if (signal != ExecutionControl.Signal.NONE) {
                    return stop(execution, signal);
                }
                stageListener.accept(stage.label());
                signal = runStage(execution, stage, pool);
                if (signal != ExecutionControl.Signal.NONE) {
                    return stop(execution, signal);
                }
            }
            stageListener.accept("finalizing");
            execution.saveCheckpoint(true);
            int pruned = checkpointStore.prune(task.lineageKey(), settings.checkpointKeep());
            logger.info("Task {} completed lineage {}, pruned {} checkpoints", task.taskId(), task.lineageKey(), pruned);
            return ExecutionOutcome.COMPLETED;
        } catch (RuntimeException e) {
            saveAfterFailure(execution, e);
            throw e;
        } finally {
            pool.shutdownNow();
            progressTracker.end(task.taskId());
        }
    }

    private ExecutionOutcome stop(Execution execution, ExecutionControl.Signal signal) {
        execution.saveCheckpoint(true);
        ExecutionOutcome outcome = signal == ExecutionControl.Signal.CANCEL
                ? ExecutionOutcome.CANCELLED
                : ExecutionOutcome.PAUSED;
        logger.info("Task {} stopped between batches: {}", execution.task.taskId(), outcome);
        return outcome;
    }

    private void saveAfterFailure(Execution execution, RuntimeException failure) {
        try {
            execution.saveCheckpoint(false);
        } catch (RuntimeException saveFailure) {
            failure.addSuppressed(saveFailure);
            logger.warn("Task {} could not checkpoint after failure: {}", execution.task.taskId(), saveFailure.getMessage());
        }
    }

    /**
     * Types planned by this task are reloaded only up to their cursor, so anything persisted
     * after the checkpoint is regenerated rather than trusted. Dependencies the task does not
     * produce itself are loaded from every lineage.
     */
    private void rebuildRegistry(Execution execution) {
        Set<EntityType> needed = dependencyClosure(execution.planned.keySet());
        for (EntityType type : needed) {
            if (execution.planned.containsKey(type)) {
                Cursor cursor = execution.board.cursor(type);
                if (!cursor.isStarted()) {
                    continue;
                }
                List<StoredIdentifier> ids = sink.loadIdentifiers(execution.task.lineageKey(), type, cursor.produced());
                if (ids.size() < cursor.produced()) {
                    StoredIdentifier last = ids.isEmpty() ? null : ids.get(ids.size() - 1);
                    Cursor rewound = new Cursor(ids.size(), last == null ? null : last.recordId(), 0L, ids.size());
                    logger.warn("Task {} found {} of {} checkpointed {} records, resuming from {}",
                            execution.task.taskId(), ids.size(), cursor.produced(), type.key(), ids.size());
                    execution.board.reset(type, rewound);
                }
                execution.registry.load(type, ids);
            } else {
                List<StoredIdentifier> ids = sink.loadIdentifiers(type);
                execution.registry.load(type, ids);
                logger.debug("Task {} loaded {} existing {} identifiers", execution.task.taskId(), ids.size(), type.key());
            }
        }
    }

    static Set<EntityType> dependencyClosure(Set<EntityType> types) {
        Set<EntityType> out = EnumSet.noneOf(EntityType.class);
        Deque<EntityType> pending = new ArrayDeque<>(types);
        while (!pending.isEmpty()) {
            EntityType type = pending.pop();
            if (out.add(type)) {
                pending.addAll(type.dependencies());
            }
        }
        return out;
    }

    private ExecutionControl.Signal runStage(Execution execution, StagePlan.Stage stage, ExecutorService pool) {
        AtomicBoolean abort = new AtomicBoolean(false);
        List<Future<ExecutionControl.Signal>> futures = new ArrayList<>();
        for (EntityType type : stage.types()) {
            futures.add(pool.submit(() -> runType(execution, type, abort)));
        }
        ExecutionControl.Signal result = ExecutionControl.Signal.NONE;
        RuntimeException failure = null;
        for (Future<ExecutionControl.Signal> future : futures) {
            try {
                ExecutionControl.Signal signal = future.get();
                if (signal == ExecutionControl.Signal.CANCEL
                        || (signal == ExecutionControl.Signal.PAUSE && result == ExecutionControl.Signal.NONE)) {
                    result = signal;
                }
            } catch (ExecutionException e) {
                abort.set(true);
                RuntimeException cause = unwrap(e);
                if (failure == null) {
                    failure = cause;
                } else if (failure != cause) {
                    failure.addSuppressed(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort.set(true);
                if (failure == null) {
                    failure = new PersistenceException("Interrupted while waiting for stage " + stage.label(), e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return result;
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new GeneratorException("Worker failed", cause);
    }

    private ExecutionControl.Signal runType(Execution execution, EntityType type, AtomicBoolean abort) {
        long target = execution.planned.get(type);
        Cursor cursor = execution.board.cursor(type);
        EntityGenerator generator = generators.get(type);
        String taskId = execution.task.taskId();
        while (cursor.produced() < target) {
            ExecutionControl.Signal signal = execution.control.check();
            if (signal != ExecutionControl.Signal.NONE || abort.get()) {
                return signal;
            }
            int count = (int) Math.min(settings.batchSize(), target - cursor.produced());
            GenerationRequest request = new GenerationRequest(type, cursor, count, execution.task.window(),
                    execution.registry, settings.randomSeed(), execution.task.lineageTag(), target);
            long started = System.nanoTime();
            GeneratedBatch batch = generateWithRetry(generator, request, taskId);
            List<GeneratedRecord> records = batch.records();
            if (records.isEmpty() || batch.next().produced() != cursor.produced() + records.size()) {
                throw new GeneratorException(type.key() + " generator made no progress at position " + cursor.produced());
            }
            for (GeneratedRecord record : records) {
                if (record.type() != type) {
                    throw new IntegrityException("Generator for " + type.key() + " emitted " + record.type().key());
                }
                execution.registry.verify(record);
            }
            RecordValidator.BatchValidation validation = validator.validate(records);
            sink.append(taskId, execution.task.lineageKey(), records);
            execution.registry.registerAll(records);
            validationRecorder.recordBatch(taskId, type, validation);
            progressTracker.recordBatch(taskId, type, records.size(), (System.nanoTime() - started) / 1_000_000L);
            long batches = execution.board.publish(type, batch.next());
            cursor = batch.next();
            if (batches % settings.checkpointEveryBatches() == 0) {
                execution.saveCheckpoint(false);
            }
        }
        return ExecutionControl.Signal.NONE;
    }

    private GeneratedBatch generateWithRetry(EntityGenerator generator, GenerationRequest request, String taskId) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= settings.batchMaxAttempts(); attempt++) {
            try {
                return generator.generate(request);
            } catch (IntegrityException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                logger.warn("Task {} {} batch at {} failed (attempt {}/{}): {}", taskId, request.type().key(),
                        request.cursor().produced(), attempt, settings.batchMaxAttempts(), e.getMessage());
                if (attempt < settings.batchMaxAttempts()) {
                    pause(settings.batchRetryDelayMs());
                }
            }
        }
        throw new GeneratorException(request.type().key() + " batch at position " + request.cursor().produced()
                + " failed after " + settings.batchMaxAttempts() + " attempts", last);
    }

    private static void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException("Interrupted during batch retry delay", e);
        }
    }

    private static ThreadFactory workerThreads(String taskId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "bankseed-worker-" + taskId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Mutable state of one run of one task.
     */
    private final class Execution {
        private final TaskView task;
        private final Map<EntityType, Long> planned;
        private final ExecutionControl control;
        private final CursorBoard board;
        private final IdentifierRegistry registry = new IdentifierRegistry();
        private final Object saveLock = new Object();
        private long savedVersion = -1L;

        private Execution(TaskView task, Map<EntityType, Long> planned, CheckpointPayload start, ExecutionControl control) {
            this.task = task;
            this.planned = planned;
            this.control = control;
            this.board = new CursorBoard(start);
        }

        /**
         * Saves the current board. Saves are serialized; a save that finds its state already
         * written by a concurrent caller is skipped unless {@code force} is set.
         */
        private void saveCheckpoint(boolean force) {
            synchronized (saveLock) {
                CursorBoard.VersionedPayload snapshot = board.versionedSnapshot();
                if (!force && snapshot.version() == savedVersion) {
                    return;
                }
                PersistenceException last = null;
                for (int attempt = 1; attempt <= settings.batchMaxAttempts(); attempt++) {
                    try {
                        Checkpoint saved = checkpointStore.save(task.taskId(), task.lineageKey(), snapshot.payload());
                        savedVersion = snapshot.version();
                        logger.debug("Task {} checkpoint seq {} at {} records", task.taskId(), saved.sequence(),
                                snapshot.payload().totalProduced());
                        return;
                    } catch (PersistenceException e) {
                        last = e;
                        logger.warn("Task {} checkpoint attempt {}/{} failed: {}", task.taskId(), attempt,
                                settings.batchMaxAttempts(), e.getMessage());
                        if (attempt < settings.batchMaxAttempts()) {
                            pause(settings.batchRetryDelayMs());
                        }
                    }
                }
                throw last;
            }
        }
    }
}
