package com.aejis.sandbox;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Host-side view of one pool container. Status and last-use time are mutated only by
 * {@link ContainerPoolManager}, under the lease that guards the handle.
 */
public final class ContainerHandle {

    private final String id;
    private final String name;
    private final PoolMembership membership;
    private final Instant createdAt;
    private final Path scratchDir;
    private volatile ContainerStatus status;
    private volatile Instant lastUsedAt;

    public ContainerHandle(String id, String name, PoolMembership membership, Instant createdAt, Path scratchDir) {
        this.id = id;
        this.name = name;
        this.membership = membership;
        this.createdAt = createdAt;
        this.scratchDir = scratchDir;
        this.status = ContainerStatus.STARTING;
        this.lastUsedAt = createdAt;
    }

    public String id() { return id; }
    public String name() { return name; }
    public PoolMembership membership() { return membership; }
    public Instant createdAt() { return createdAt; }
    public Instant lastUsedAt() { return lastUsedAt; }
    public Path scratchDir() { return scratchDir; }
    public ContainerStatus status() { return status; }

    public boolean isWarm() {
        return membership == PoolMembership.WARM;
    }

    void markStatus(ContainerStatus status) {
        this.status = status;
    }

    void touch(Instant now) {
        this.lastUsedAt = now;
    }

    @Override
    public String toString() {
        return "ContainerHandle[" + name + " " + shortId() + " " + membership + " " + status + "]";
    }

    public String shortId() {
        return id != null && id.length() > 12 ? id.substring(0, 12) : id;
    }
}
