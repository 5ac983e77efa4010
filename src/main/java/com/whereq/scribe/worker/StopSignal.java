package com.whereq.scribe.worker;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop request shared by the workers of a pool.
 * Workers look at it only between jobs, never while one is running.
 */
public final class StopSignal {

    private final CountDownLatch stopped = new CountDownLatch(1);

    public void requestStop() {
        stopped.countDown();
    }

    public boolean isStopRequested() {
        return stopped.getCount() == 0;
    }

    /**
     * Sleep for up to {@code timeout}, waking early on a stop request.
     *
     * @return true if stop was requested
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
