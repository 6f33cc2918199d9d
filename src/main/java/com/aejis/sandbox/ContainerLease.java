package com.aejis.sandbox;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of one container for one job. Returned to the pool exactly once via
 * {@link ContainerPoolManager#release(ContainerLease)}; later calls are no-ops.
 */
public final class ContainerLease {

    private final ContainerHandle handle;
    private final IsolationPolicy policy;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean unhealthy;

    ContainerLease(ContainerHandle handle, IsolationPolicy policy) {
        this.handle = handle;
        this.policy = policy;
    }

    public ContainerHandle handle() {
        return handle;
    }

    public IsolationPolicy policy() {
        return policy;
    }

    public String containerId() {
        return handle.id();
    }

    /**
     * Flags the container as not reusable, e.g. after a forced kill. A warm container
     * marked this way is destroyed on release and recreated on the next acquire.
     */
    public void markUnhealthy() {
        this.unhealthy = true;
    }

    public boolean isUnhealthy() {
        return unhealthy;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
