package io.bankseed.orchestrator;

/**
 * How an execution ended when it did not throw.
 */
public enum ExecutionOutcome {
    COMPLETED,
    PAUSED,
    CANCELLED
}
