package com.pitchscope.testutil;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that rejects every task, simulating a saturated bounded pool.
 */
public class RejectingExecutor implements Executor {
    private final AtomicInteger rejected = new AtomicInteger();

    @Override
    public void execute(Runnable command) {
        rejected.incrementAndGet();
        throw new RejectedExecutionException("saturated");
    }

    public int rejectedCount() {
        return rejected.get();
    }
}
