package io.bankseed.task;

import io.bankseed.config.GenerationSettings;

/**
 * Task-level retry budget. Delays double from {@code baseBackoffMs} and stop growing at
 * {@code maxBackoffMs}, so successive delays never decrease.
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {

    public static RetryPolicy fromSettings(GenerationSettings settings) {
        return new RetryPolicy(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs());
    }

    public boolean canRetry(int attemptsUsed) {
        return attemptsUsed < maxAttempts;
    }

    /**
     * Delay before the attempt that follows failed attempt number {@code attempt} (1-based).
     */
    public long delayMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, maxBackoffMs);
    }
}
