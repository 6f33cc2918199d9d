package com.aejis.sandbox.monitor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token held by the caller of a job. Cancelling does not ask the running
 * processor to stop; the monitor force-kills it on its next poll.
 */
public final class JobCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static JobCancellation none() {
        return new JobCancellation();
    }

    /** @return true if this call changed the token */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
