package com.example.agentflow.orchestration;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for one workflow run. Cancelling also interrupts the agent calls currently in flight.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true if this call cancelled the run, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        inFlight.forEach(future -> future.cancel(true));
        return true;
    }

    void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
