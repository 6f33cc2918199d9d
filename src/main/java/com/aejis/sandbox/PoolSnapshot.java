package com.aejis.sandbox;

import java.time.Instant;

/**
 * Point-in-time view of the pool for health checks and the CLI.
 *
 * @param mode               current pool mode
 * @param warmContainerId    id of the warm container, null if none
 * @param warmStatus         status of the warm container, null if none
 * @param warmLastUsedAt     last time a job ran on the warm container, null if none
 * @param ephemeralInFlight  ephemeral containers currently leased
 * @param ephemeralCapacity  configured maximum of concurrent ephemeral containers
 * @param warmRetryAt        when the warm container will be tried again, null unless degraded
 */
public record PoolSnapshot(
    PoolMode mode,
    String warmContainerId,
    ContainerStatus warmStatus,
    Instant warmLastUsedAt,
    int ephemeralInFlight,
    int ephemeralCapacity,
    Instant warmRetryAt
) {}
