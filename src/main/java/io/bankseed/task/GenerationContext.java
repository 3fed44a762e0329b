package io.bankseed.task;

import io.bankseed.config.BankSeedConfig;
import io.bankseed.config.GenerationSettings;
import io.bankseed.generator.GeneratorRegistry;
import io.bankseed.generator.VolumePlanner;
import io.bankseed.observability.TransitionAuditLog;
import io.bankseed.orchestrator.GenerationOrchestrator;
import io.bankseed.progress.ProgressTracker;
import io.bankseed.storage.CheckpointStore;
import io.bankseed.storage.Database;
import io.bankseed.storage.RecordSink;
import io.bankseed.storage.SqliteRecordSink;
import io.bankseed.storage.TaskStore;
import io.bankseed.time.TimeRuleEngine;
import io.bankseed.validation.RecordValidator;
import io.bankseed.validation.ValidationRecorder;

import java.time.Clock;

/**
 * Wiring for one data root. Everything the engine needs is reachable from here; nothing is
 * held in static state.
 */
public final class GenerationContext {
    private final BankSeedConfig config;
    private final GenerationSettings settings;
    private final Clock clock;
    private final Database database;
    private final TaskStore taskStore;
    private final CheckpointStore checkpointStore;
    private final RecordSink recordSink;
    private final GeneratorRegistry generators;
    private final VolumePlanner planner;
    private final ValidationRecorder validationRecorder;
    private final ProgressTracker progressTracker;
    private final GenerationOrchestrator orchestrator;
    private final TimeRuleEngine timeRules;
    private final TransitionAuditLog auditLog;

    private GenerationContext(Builder b) {
        this.config = b.config;
        this.settings = b.settings == null ? GenerationSettings.load(b.config) : b.settings;
        this.clock = b.clock == null ? Clock.system(settings.zone()) : b.clock;
        this.database = new Database(config, settings.storageTimeoutMs());
        this.database.init();
        this.taskStore = new TaskStore(database);
        this.checkpointStore = new CheckpointStore(database);
        this.recordSink = b.recordSink == null ? new SqliteRecordSink(database) : b.recordSink;
        this.generators = b.generators == null ? GeneratorRegistry.defaults(settings.zone()) : b.generators;
        this.planner = new VolumePlanner(settings);
        this.validationRecorder = new ValidationRecorder(database, settings);
        this.progressTracker = new ProgressTracker(taskStore, checkpointStore, planner, clock);
        this.orchestrator = new GenerationOrchestrator(
                settings,
                generators,
                recordSink,
                checkpointStore,
                new RecordValidator(),
                validationRecorder,
                progressTracker,
                planner
        );
        this.timeRules = TimeRuleEngine.fromSettings(settings);
        this.auditLog = new TransitionAuditLog(config.auditFile());
    }

    public static Builder builder(BankSeedConfig config) {
        return new Builder(config);
    }

    public static GenerationContext open(BankSeedConfig config) {
        return builder(config).build();
    }

    public BankSeedConfig config() {
        return config;
    }

    public GenerationSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }

    public RecordSink recordSink() {
        return recordSink;
    }

    public GeneratorRegistry generators() {
        return generators;
    }

    public VolumePlanner planner() {
        return planner;
    }

    public ValidationRecorder validationRecorder() {
        return validationRecorder;
    }

    public ProgressTracker progressTracker() {
        return progressTracker;
    }

    public GenerationOrchestrator orchestrator() {
        return orchestrator;
    }

    public TimeRuleEngine timeRules() {
        return timeRules;
    }

    public TransitionAuditLog auditLog() {
        return auditLog;
    }

    public static final class Builder {
        private final BankSeedConfig config;
        private GenerationSettings settings;
        private Clock clock;
        private RecordSink recordSink;
        private GeneratorRegistry generators;

        private Builder(BankSeedConfig config) {
            this.config = config;
        }

        public Builder settings(GenerationSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder recordSink(RecordSink recordSink) {
            this.recordSink = recordSink;
            return this;
        }

        public Builder generators(GeneratorRegistry generators) {
            this.generators = generators;
            return this;
        }

        public GenerationContext build() {
            return new GenerationContext(this);
        }
    }
}
