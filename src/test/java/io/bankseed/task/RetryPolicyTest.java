package io.bankseed.task;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RetryPolicyTest {

    @Test
    void delaysDoubleUpToTheCap() {
        RetryPolicy policy = new RetryPolicy(6, 30_000L, 900_000L);
        Assertions.assertEquals(30_000L, policy.delayMs(1));
        Assertions.assertEquals(60_000L, policy.delayMs(2));
        Assertions.assertEquals(120_000L, policy.delayMs(3));
        Assertions.assertEquals(480_000L, policy.delayMs(5));
        Assertions.assertEquals(900_000L, policy.delayMs(6));
        Assertions.assertEquals(900_000L, policy.delayMs(60));
    }

    @Test
    void delaysNeverDecrease() {
        RetryPolicy policy = new RetryPolicy(100, 7L, 1_000L);
        long previous = 0L;
        for (int attempt = 1; attempt <= 100; attempt++) {
            long delay = policy.delayMs(attempt);
            Assertions.assertTrue(delay >= previous, "attempt " + attempt);
            previous = delay;
        }
        Assertions.assertEquals(1_000L, previous);
    }

    @Test
    void budgetCountsAttemptsAlreadyUsed() {
        RetryPolicy policy = new RetryPolicy(3, 10L, 40L);
        Assertions.assertTrue(policy.canRetry(1));
        Assertions.assertTrue(policy.canRetry(2));
        Assertions.assertFalse(policy.canRetry(3));
    }
}
