package com.aejis.sandbox;

import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;

import java.nio.file.Path;
import java.util.Map;

/**
 * The single code path that turns an {@link IsolationPolicy} into a docker
 * {@link HostConfig}. Every container the engine starts goes through {@link #build};
 * no processor or pool mode gets its own variant.
 */
public final class HostConfigFactory {

    /** Mount point of the per-job scratch directory inside the container. */
    public static final String SCRATCH_MOUNT = "/scratch";

    /** Path of the staged artifact inside the container. */
    public static final String SCRATCH_INPUT = SCRATCH_MOUNT + "/input";

    private HostConfigFactory() {}

    public static HostConfig build(IsolationPolicy policy, Path scratchDir) {
        if (policy == null) {
            throw new IllegalArgumentException("an isolation policy is required for every container");
        }
        var hostConfig = HostConfig.newHostConfig()
                .withNetworkMode(policy.networkMode())
                .withReadonlyRootfs(true)
                .withSecurityOpts(policy.securityOpts())
                .withCapDrop(Capability.ALL)
                .withMemory(policy.memoryLimitBytes())
                .withMemorySwap(policy.memoryLimitBytes())
                .withCpuQuota(policy.cpuQuota())
                .withCpuPeriod(policy.cpuPeriod())
                .withPidsLimit(policy.pidsLimit())
                .withTmpFs(Map.of("/tmp", "rw,noexec,nosuid,nodev,size=" + policy.tmpfsSizeBytes()));
        if (scratchDir != null) {
            hostConfig.withBinds(new Bind(scratchDir.toAbsolutePath().toString(),
                    new Volume(SCRATCH_MOUNT), AccessMode.ro));
        }
        return hostConfig;
    }
}
