package com.elssolution.vuegraf.usage;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A sleep that {@link #cancel()} ends immediately, for this and every later pause.
 */
public class CancellablePause {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /** @return true if cancelled before or during the wait */
    public boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) return isCancelled();
        try {
            return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
}
