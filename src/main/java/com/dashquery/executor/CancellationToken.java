package com.dashquery.executor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-driven cancellation flag for one analysis run.
 * Cancelling stops queries that have not started and queries waiting to retry; queries
 * already in flight run to completion or to their timeout.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Wait up to {@code millis} for cancellation.
     *
     * @return true if the token was cancelled within the wait
     */
    public boolean await(long millis) throws InterruptedException {
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * A fresh, not-cancelled token.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }
}
