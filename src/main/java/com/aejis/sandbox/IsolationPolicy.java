package com.aejis.sandbox;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable sandbox contract attached to every container invocation, warm or ephemeral.
 *
 * <p>The network, filesystem and privilege fields are not really choices: the compact
 * constructor rejects anything but {@code none}, {@code read_only} and a security option
 * list containing {@code no-new-privileges:true}. Only the resource limits vary.
 *
 * @param memoryLimitBytes hard memory ceiling; swap is pinned to the same value
 * @param cpuQuota         CFS quota in microseconds per {@code cpuPeriod}
 * @param cpuPeriod        CFS period in microseconds
 * @param pidsLimit        maximum number of processes inside the container
 * @param networkMode      always {@value #NETWORK_NONE}
 * @param filesystemMode   always {@value #FS_READ_ONLY}
 * @param securityOpts     docker security options, must include {@value #NO_NEW_PRIVILEGES}
 * @param maxWallTime      wall-clock budget for one job
 * @param tmpfsSizeBytes   size of the non-executable tmpfs mounted at {@code /tmp}
 */
public record IsolationPolicy(
    long memoryLimitBytes,
    long cpuQuota,
    long cpuPeriod,
    long pidsLimit,
    String networkMode,
    String filesystemMode,
    List<String> securityOpts,
    Duration maxWallTime,
    long tmpfsSizeBytes
) {

    public static final String NETWORK_NONE = "none";
    public static final String FS_READ_ONLY = "read_only";
    public static final String NO_NEW_PRIVILEGES = "no-new-privileges:true";

    public IsolationPolicy {
        if (!NETWORK_NONE.equals(networkMode)) {
            throw new IllegalArgumentException("network mode must be 'none', got: " + networkMode);
        }
        if (!FS_READ_ONLY.equals(filesystemMode)) {
            throw new IllegalArgumentException("filesystem mode must be 'read_only', got: " + filesystemMode);
        }
        Objects.requireNonNull(securityOpts, "securityOpts");
        if (!securityOpts.contains(NO_NEW_PRIVILEGES)) {
            throw new IllegalArgumentException("security options must include " + NO_NEW_PRIVILEGES);
        }
        Objects.requireNonNull(maxWallTime, "maxWallTime");
        if (maxWallTime.isZero() || maxWallTime.isNegative()) {
            throw new IllegalArgumentException("maxWallTime must be positive");
        }
        if (memoryLimitBytes <= 0 || cpuQuota <= 0 || cpuPeriod <= 0 || pidsLimit <= 0 || tmpfsSizeBytes <= 0) {
            throw new IllegalArgumentException("resource limits must be positive");
        }
        securityOpts = List.copyOf(securityOpts);
    }

    /**
     * Builds a policy with the fixed isolation fields and the given resource limits.
     */
    public static IsolationPolicy of(long memoryLimitBytes, long cpuQuota, long cpuPeriod, long pidsLimit,
                                     Duration maxWallTime, long tmpfsSizeBytes) {
        return new IsolationPolicy(memoryLimitBytes, cpuQuota, cpuPeriod, pidsLimit, NETWORK_NONE,
                FS_READ_ONLY, List.of(NO_NEW_PRIVILEGES), maxWallTime, tmpfsSizeBytes);
    }

    public static IsolationPolicy defaults() {
        return of(512L * 1024 * 1024, 100_000, 100_000, 128, Duration.ofSeconds(30), 64L * 1024 * 1024);
    }

    /**
     * Applies a per-job override without letting it loosen this policy: every limit
     * is the smaller of the two.
     */
    public IsolationPolicy constrainedBy(IsolationPolicy override) {
        if (override == null) {
            return this;
        }
        double thisShare = (double) cpuQuota / cpuPeriod;
        double overrideShare = (double) override.cpuQuota / override.cpuPeriod;
        boolean keepCpu = thisShare <= overrideShare;
        Duration wall = override.maxWallTime.compareTo(maxWallTime) < 0 ? override.maxWallTime : maxWallTime;
        return of(
                Math.min(memoryLimitBytes, override.memoryLimitBytes),
                keepCpu ? cpuQuota : override.cpuQuota,
                keepCpu ? cpuPeriod : override.cpuPeriod,
                Math.min(pidsLimit, override.pidsLimit),
                wall,
                Math.min(tmpfsSizeBytes, override.tmpfsSizeBytes));
    }
}
