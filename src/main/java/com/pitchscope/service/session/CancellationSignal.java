package com.pitchscope.service.session;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag shared between the orchestrator and a session's transcription loops.
 *
 * <p>Loops check {@link #isCancelled()} between iterations and use {@link #await(Duration)} in
 * place of {@code Thread.sleep}, so a cancel wakes a pacing or polling delay immediately.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the signal was cancelled before or during the wait
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** A signal that is never cancelled. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }
}
