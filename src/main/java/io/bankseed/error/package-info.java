/**
 * Unchecked exception hierarchy shared by the stores, the orchestrator and the task manager.
 */
package io.bankseed.error;
