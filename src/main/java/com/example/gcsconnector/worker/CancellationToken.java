package com.example.gcsconnector.worker;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Stop signal shared by the uploaders. Sleeping on it returns as soon as it is cancelled.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout}.
     *
     * @return true if the token was cancelled (or the thread interrupted) before the time ran out
     */
    public boolean await(Duration timeout) {
        try {
            return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
