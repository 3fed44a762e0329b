/**
 * BankSeed source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.bankseed.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.bankseed.cli.BankSeedCommand} maps commands to the task manager.</li>
 *   <li>{@code io.bankseed.task.TaskManager} owns task state changes, retries and recovery.</li>
 *   <li>{@code io.bankseed.orchestrator.GenerationOrchestrator} runs the staged, checkpointed generation.</li>
 *   <li>{@code io.bankseed.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.bankseed;
