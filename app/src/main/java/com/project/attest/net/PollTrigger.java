package com.project.attest.net;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Lets a push notification (webhook, subscription) cut a poll wait short.
 *
 * Firing only ever causes an earlier poll; a lost notification means the poller waits its normal
 * interval, and duplicates collapse into one wake-up.
 */
public final class PollTrigger {

    private final Semaphore signal = new Semaphore(0);

    public void fire() {
        if (signal.availablePermits() == 0) {
            signal.release();
        }
    }

    /**
     * Waits up to {@code maxWait}; returns {@code true} if woken early by {@link #fire()}.
     */
    public boolean await(Duration maxWait) throws InterruptedException {
        long millis = Math.max(0, maxWait.toMillis());
        boolean early = signal.tryAcquire(millis, TimeUnit.MILLISECONDS);
        signal.drainPermits();
        return early;
    }
}
