package com.aejis.sandbox;

import com.aejis.core.events.AejisEvent;
import com.aejis.core.events.EventBus;
import com.aejis.core.metrics.AejisMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Owns the warm container and hands out ephemeral ones.
 *
 * <p>The warm container is created lazily on the first acquire, validated by a no-op
 * exec before every lease and serialized through a fair single-permit semaphore. When
 * the probe fails it is destroyed and recreated once; if that fails too the pool
 * switches to {@link PoolMode#EPHEMERAL_ONLY} and tries the warm container again after
 * the configured retry interval. An unreachable runtime puts the pool in
 * {@link PoolMode#DOCKER_REQUIRED}, re-evaluated on every acquire.
 *
 * <p>Each handle has its own scratch directory on the host, bind-mounted read-only into
 * the container. It is wiped before an artifact is staged and again on release, on every
 * exit path, so no two jobs' artifacts ever coexist in it. The warm container's writable
 * {@code /tmp} is emptied on both sides of every lease; a container whose cleanup fails
 * is not handed out again.
 */
@Service
public class ContainerPoolManager {

    private static final Logger log = LoggerFactory.getLogger(ContainerPoolManager.class);

    public static final String POOL_LABEL = "aejis.pool";
    public static final String EPHEMERAL_PREFIX = "aejis-eph-";
    static final List<String> KEEP_ALIVE = List.of("sleep", "infinity");
    static final List<String> TMP_CLEANUP = List.of("find", "/tmp", "-mindepth", "1", "-delete");

    private final SandboxProvider provider;
    private final SandboxProperties properties;
    private final Clock clock;
    private final AejisMetrics metrics;
    private final EventBus eventBus;

    private final Semaphore warmLease = new Semaphore(1, true);
    private final Semaphore ephemeralPermits;
    private final Set<ContainerHandle> ephemeralInFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean staleSwept = new AtomicBoolean();

    /** Guarded by {@link #warmLease}. */
    private volatile ContainerHandle warm;
    private volatile PoolMode mode = PoolMode.WARM;
    private volatile Instant warmRetryAt;

    @Autowired
    public ContainerPoolManager(SandboxProvider provider,
                                SandboxProperties properties,
                                @Autowired(required = false) AejisMetrics metrics,
                                @Autowired(required = false) EventBus eventBus) {
        this(provider, properties, Clock.systemUTC(), metrics, eventBus);
    }

    public ContainerPoolManager(SandboxProvider provider, SandboxProperties properties, Clock clock,
                                AejisMetrics metrics, EventBus eventBus) {
        this.provider = provider;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.ephemeralPermits = new Semaphore(Math.max(1, properties.getMaxEphemeral()), true);
        if (!properties.isWarmEnabled()) {
            this.mode = PoolMode.EPHEMERAL_ONLY;
        }
    }

    /**
     * Leases a container constructed under {@code policy}.
     *
     * <p>Isolation-sensitive jobs, and jobs whose policy asks for different container
     * limits than the warm container was built with, always get a fresh ephemeral
     * container. Waits up to the policy's wall time in total.
     *
     * @see #acquire(IsolationPolicy, boolean, Duration)
     */
    public ContainerLease acquire(IsolationPolicy policy, boolean isolationSensitive) {
        return acquire(policy, isolationSensitive, policy.maxWallTime());
    }

    /**
     * Leases a container constructed under {@code policy}, waiting at most
     * {@code waitBudget} in total: time spent queueing for the warm container is taken
     * from what is left for an ephemeral slot.
     *
     * @throws ContainerTimeoutException     if no slot frees up within the budget
     * @throws ContainerUnavailableException if the container runtime is unreachable or
     *                                       no container could be created
     */
    public ContainerLease acquire(IsolationPolicy policy, boolean isolationSensitive, Duration waitBudget) {
        long deadlineNanos = System.nanoTime() + Math.max(0, waitBudget.toNanos());
        if (!provider.isAvailable()) {
            enterDockerRequired();
            throw new ContainerUnavailableException("Container runtime is unreachable; no sandbox available");
        }
        leaveDockerRequired();
        sweepStaleEphemerals();

        if (!isolationSensitive && sharesWarmLimits(policy) && warmUsable()) {
            ContainerLease lease = acquireWarm(policy, deadlineNanos);
            if (lease != null) {
                return lease;
            }
        }
        return acquireEphemeral(policy, waitBudget, deadlineNanos);
    }

    /**
     * Wipes the handle's scratch directory and writes the artifact as its only file.
     *
     * @return host path of the staged artifact
     * @throws StagingException if the scratch directory cannot be prepared or written
     */
    public Path stage(ContainerLease lease, byte[] artifact) {
        Path scratch = lease.handle().scratchDir();
        wipe(scratch);
        Path input = scratch.resolve("input");
        try {
            Files.write(input, artifact);
            if (!input.toFile().setReadable(true, false)) {
                log.debug("Could not widen read permission on {}", input);
            }
            return input;
        } catch (IOException e) {
            throw new StagingException("Failed to stage artifact into " + scratch, e);
        }
    }

    /**
     * Returns a lease to the pool. Scratch data is wiped first; ephemeral containers are
     * removed, a warm container flagged unhealthy is destroyed. Safe to call more than once.
     */
    public void release(ContainerLease lease) {
        if (lease == null || !lease.markReleased()) {
            return;
        }
        ContainerHandle handle = lease.handle();
        try {
            try {
                wipe(handle.scratchDir());
            } catch (StagingException e) {
                log.error("Scratch wipe failed for {}; container will not be reused", handle.name(), e);
                lease.markUnhealthy();
            }
            if (handle.isWarm()) {
                releaseWarm(lease);
            } else {
                releaseEphemeral(handle);
            }
        } finally {
            if (handle.isWarm()) {
                warmLease.release();
            } else {
                ephemeralInFlight.remove(handle);
                ephemeralPermits.release();
            }
        }
    }

    /**
     * Destroys the warm container so the next acquire builds a fresh one, e.g. after the
     * configured limits changed.
     */
    public void resetWarm() {
        warmLease.acquireUninterruptibly();
        try {
            destroyWarm();
            Optional<String> leftover = findQuietly(properties.getWarmName());
            leftover.ifPresent(this::removeQuietly);
            if (properties.isWarmEnabled()) {
                mode = PoolMode.WARM;
                warmRetryAt = null;
            }
        } finally {
            warmLease.release();
        }
    }

    public PoolSnapshot snapshot() {
        ContainerHandle w = warm;
        return new PoolSnapshot(
                mode,
                w != null ? w.id() : null,
                w != null ? w.status() : null,
                w != null ? w.lastUsedAt() : null,
                ephemeralInFlight.size(),
                properties.getMaxEphemeral(),
                warmRetryAt);
    }

    public PoolMode mode() {
        return mode;
    }

    @PreDestroy
    public void shutdown() {
        for (ContainerHandle handle : ephemeralInFlight) {
            log.info("Removing in-flight ephemeral container {} on shutdown", handle.name());
            removeQuietly(handle.id());
        }
    }

    // -- warm path --

    private ContainerLease acquireWarm(IsolationPolicy policy, long deadlineNanos) {
        try {
            if (!warmLease.tryAcquire(remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS)) {
                log.debug("Warm container still busy at the wait deadline; trying an ephemeral container");
                return null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerUnavailableException("Interrupted while waiting for the warm container", e);
        }
        boolean leased = false;
        try {
            ContainerHandle handle = ensureWarm();
            if (handle == null) {
                return null;
            }
            if (!cleanTmp(handle)) {
                log.warn("Warm container {} could not clear /tmp before the lease; destroying", handle.shortId());
                destroyWarm();
                return null;
            }
            handle.markStatus(ContainerStatus.BUSY);
            handle.touch(clock.instant());
            leased = true;
            record("warm");
            publish("container.acquired", handle, Map.of("membership", "warm"));
            return new ContainerLease(handle, policy);
        } finally {
            if (!leased) {
                warmLease.release();
            }
        }
    }

    /**
     * Returns a healthy warm container, creating or recreating it as needed, or
     * {@code null} after degrading the pool to ephemeral-only. Caller holds the warm lease.
     */
    private ContainerHandle ensureWarm() {
        ContainerHandle current = warm;
        boolean recreating = false;

        if (current == null) {
            Optional<String> existing = findQuietly(properties.getWarmName());
            if (existing.isPresent()) {
                String id = existing.get();
                if (runningQuietly(id) && provider.probe(id, properties.getProbeTimeout())) {
                    log.info("Resuming warm container {} ({})", properties.getWarmName(), id);
                    current = new ContainerHandle(id, properties.getWarmName(), PoolMembership.WARM,
                            clock.instant(), prepareScratchDir(properties.getWarmName()));
                    current.markStatus(ContainerStatus.READY);
                    warm = current;
                    markWarmRecovered();
                    return current;
                }
                log.warn("Existing warm container {} is not healthy; replacing it", id);
                removeQuietly(id);
                recreating = true;
            }
        } else if (current.status() != ContainerStatus.DEAD
                && provider.probe(current.id(), properties.getProbeTimeout())) {
            return current;
        } else {
            log.warn("Warm container {} failed its health probe; recreating", current.shortId());
            destroyWarm();
            recreating = true;
        }

        ContainerHandle created = createWarm();
        if (recreating && metrics != null) {
            metrics.recordWarmRecreation(created != null);
        }
        if (created == null) {
            degradeToEphemeral();
            return null;
        }
        markWarmRecovered();
        return created;
    }

    private ContainerHandle createWarm() {
        String name = properties.getWarmName();
        try {
            Path scratch = prepareScratchDir(name);
            var spec = new ContainerSpec(name, properties.getImage(), Map.of(POOL_LABEL, "warm"),
                    properties.toIsolationPolicy(), scratch, KEEP_ALIVE);
            String id = provider.createContainer(spec);
            var handle = new ContainerHandle(id, name, PoolMembership.WARM, clock.instant(), scratch);
            warm = handle;
            if (!provider.probe(id, properties.getProbeTimeout())) {
                log.warn("Newly created warm container {} failed its health probe", handle.shortId());
                destroyWarm();
                return null;
            }
            handle.markStatus(ContainerStatus.READY);
            log.info("Warm container {} ready ({})", name, handle.shortId());
            return handle;
        } catch (SandboxException e) {
            log.warn("Could not create warm container {}: {}", name, e.getMessage());
            return null;
        }
    }

    private void releaseWarm(ContainerLease lease) {
        ContainerHandle handle = lease.handle();
        handle.touch(clock.instant());
        if (lease.isUnhealthy()) {
            log.info("Warm container {} marked dead after job; destroying", handle.shortId());
            handle.markStatus(ContainerStatus.DEAD);
            destroyWarm();
        } else if (!cleanTmp(handle)) {
            log.warn("Warm container {} could not clear /tmp after the job; destroying", handle.shortId());
            handle.markStatus(ContainerStatus.DEAD);
            destroyWarm();
        } else {
            handle.markStatus(ContainerStatus.READY);
        }
    }

    /** Empties the warm container's writable /tmp, keeping the mount point. */
    private boolean cleanTmp(ContainerHandle handle) {
        return provider.run(handle.id(), TMP_CLEANUP, properties.getProbeTimeout());
    }

    /** Caller holds the warm lease. */
    private void destroyWarm() {
        ContainerHandle current = warm;
        warm = null;
        if (current == null) {
            return;
        }
        current.markStatus(ContainerStatus.DEAD);
        removeQuietly(current.id());
    }

    private boolean warmUsable() {
        if (mode == PoolMode.WARM) {
            return true;
        }
        if (mode == PoolMode.EPHEMERAL_ONLY && properties.isWarmEnabled()) {
            Instant retryAt = warmRetryAt;
            return retryAt != null && !clock.instant().isBefore(retryAt);
        }
        return false;
    }

    private boolean sharesWarmLimits(IsolationPolicy policy) {
        IsolationPolicy base = properties.toIsolationPolicy();
        return policy.memoryLimitBytes() == base.memoryLimitBytes()
                && policy.cpuQuota() == base.cpuQuota()
                && policy.cpuPeriod() == base.cpuPeriod()
                && policy.pidsLimit() == base.pidsLimit()
                && policy.tmpfsSizeBytes() == base.tmpfsSizeBytes();
    }

    private void degradeToEphemeral() {
        boolean changed = mode != PoolMode.EPHEMERAL_ONLY;
        mode = PoolMode.EPHEMERAL_ONLY;
        warmRetryAt = clock.instant().plus(properties.getWarmRetryInterval());
        if (changed) {
            log.warn("Warm container unavailable; switching to ephemeral-only mode until {}", warmRetryAt);
            if (metrics != null) {
                metrics.recordPoolDegraded(PoolMode.EPHEMERAL_ONLY.name());
            }
            publish("pool.degraded", null, Map.of("mode", PoolMode.EPHEMERAL_ONLY.name()));
        }
    }

    private void markWarmRecovered() {
        if (mode != PoolMode.WARM) {
            log.info("Warm container recovered; leaving {} mode", mode);
            mode = PoolMode.WARM;
            warmRetryAt = null;
            publish("pool.recovered", null, Map.of("mode", PoolMode.WARM.name()));
        }
    }

    // -- ephemeral path --

    private ContainerLease acquireEphemeral(IsolationPolicy policy, Duration waitBudget, long deadlineNanos) {
        try {
            if (!ephemeralPermits.tryAcquire(remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS)) {
                throw new ContainerTimeoutException("No container slot free within "
                        + waitBudget.toMillis() + "ms", waitBudget);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerUnavailableException("Interrupted while waiting for an ephemeral container slot", e);
        }
        String name = EPHEMERAL_PREFIX + UUID.randomUUID().toString().substring(0, 12);
        Path scratch = null;
        try {
            scratch = prepareScratchDir(name);
            var spec = new ContainerSpec(name, properties.getImage(), Map.of(POOL_LABEL, "ephemeral"),
                    policy, scratch, KEEP_ALIVE);
            String id = provider.createContainer(spec);
            var handle = new ContainerHandle(id, name, PoolMembership.EPHEMERAL, clock.instant(), scratch);
            handle.markStatus(ContainerStatus.BUSY);
            ephemeralInFlight.add(handle);
            record("ephemeral");
            publish("container.acquired", handle, Map.of("membership", "ephemeral"));
            return new ContainerLease(handle, policy);
        } catch (RuntimeException e) {
            ephemeralPermits.release();
            if (scratch != null) {
                deleteScratchDir(scratch);
            }
            if (e instanceof ContainerUnavailableException cue) {
                throw cue;
            }
            throw new ContainerUnavailableException("Could not create ephemeral container " + name, e);
        }
    }

    private void releaseEphemeral(ContainerHandle handle) {
        handle.markStatus(ContainerStatus.DEAD);
        removeQuietly(handle.id());
        deleteScratchDir(handle.scratchDir());
    }

    /**
     * Removes ephemeral containers left behind by an earlier process. Runs once, on the
     * first acquire that finds the runtime reachable.
     */
    private void sweepStaleEphemerals() {
        if (!staleSwept.compareAndSet(false, true)) {
            return;
        }
        try {
            List<String> stale = provider.listByLabel(POOL_LABEL, "ephemeral");
            for (String id : stale) {
                log.info("Removing stale ephemeral container {}", id);
                removeQuietly(id);
            }
        } catch (RuntimeException e) {
            log.warn("Could not list stale ephemeral containers: {}", e.getMessage());
        }
    }

    // -- docker availability --

    private void enterDockerRequired() {
        if (mode != PoolMode.DOCKER_REQUIRED) {
            log.error("Container runtime unreachable; pool is now in DOCKER_REQUIRED mode");
            mode = PoolMode.DOCKER_REQUIRED;
            if (metrics != null) {
                metrics.recordPoolDegraded(PoolMode.DOCKER_REQUIRED.name());
            }
            publish("pool.degraded", null, Map.of("mode", PoolMode.DOCKER_REQUIRED.name()));
        }
    }

    private void leaveDockerRequired() {
        if (mode == PoolMode.DOCKER_REQUIRED) {
            log.info("Container runtime reachable again");
            mode = properties.isWarmEnabled() ? PoolMode.WARM : PoolMode.EPHEMERAL_ONLY;
        }
    }

    // -- scratch space --

    Path scratchDirFor(String containerName) {
        return properties.getScratchRoot().resolve(containerName);
    }

    private Path prepareScratchDir(String containerName) {
        Path dir = scratchDirFor(containerName);
        try {
            Files.createDirectories(dir);
            if (!dir.toFile().setReadable(true, false) || !dir.toFile().setExecutable(true, false)) {
                log.debug("Could not widen permissions on {}", dir);
            }
            return dir;
        } catch (IOException e) {
            throw new StagingException("Failed to create scratch directory " + dir, e);
        }
    }

    /** Deletes everything inside {@code dir}, keeping the directory itself. */
    static void wipe(Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                if (!p.equals(dir)) {
                    Files.deleteIfExists(p);
                }
            }
        } catch (IOException e) {
            throw new StagingException("Failed to wipe scratch directory " + dir, e);
        }
    }

    private void deleteScratchDir(Path dir) {
        try {
            wipe(dir);
            Files.deleteIfExists(dir);
        } catch (IOException | StagingException e) {
            log.warn("Failed to delete scratch directory {}: {}", dir, e.getMessage());
        }
    }

    // -- helpers --

    private static long remainingNanos(long deadlineNanos) {
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    private boolean runningQuietly(String containerId) {
        try {
            return provider.isRunning(containerId);
        } catch (SandboxException e) {
            log.warn("Inspecting container {} failed: {}", containerId, e.getMessage());
            return false;
        }
    }

    private Optional<String> findQuietly(String name) {
        try {
            return provider.findContainer(name);
        } catch (RuntimeException e) {
            log.warn("Lookup of container {} failed: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private void removeQuietly(String containerId) {
        try {
            provider.remove(containerId);
        } catch (SandboxException e) {
            log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
        }
    }

    private void record(String membership) {
        if (metrics != null) {
            metrics.recordContainerAcquired(membership);
        }
    }

    private void publish(String type, ContainerHandle handle, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(AejisEvent.of(type, null, handle != null ? handle.id() : null, payload));
        }
    }
}
