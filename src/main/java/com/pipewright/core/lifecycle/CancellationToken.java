package com.pipewright.core.lifecycle;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared by the coordinator and every task of a run.
 * Waiting threads wake up as soon as {@link #cancel()} is called.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for up to {@code timeout}, returning early on cancellation. An interrupt
     * counts as cancellation; the thread's interrupt flag is restored.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration timeout) {
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
