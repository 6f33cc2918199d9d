package com.aejis.sandbox;

import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Capability;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HostConfigFactoryTest {

    private static final long MB = 1024L * 1024;

    private final IsolationPolicy policy = IsolationPolicy.of(
            256 * MB, 50_000, 100_000, 64, Duration.ofSeconds(10), 32 * MB);

    @Test
    void networkIsAlwaysNone() {
        var hostConfig = HostConfigFactory.build(policy, Path.of("/tmp/scratch"));
        assertEquals("none", hostConfig.getNetworkMode());
    }

    @Test
    void rootFilesystemIsReadOnlyWithoutPrivileges() {
        var hostConfig = HostConfigFactory.build(policy, Path.of("/tmp/scratch"));

        assertTrue(hostConfig.getReadonlyRootfs());
        assertTrue(hostConfig.getSecurityOpts().contains("no-new-privileges:true"));
        assertArrayEquals(new Capability[]{Capability.ALL}, hostConfig.getCapDrop());
    }

    @Test
    void resourceLimitsComeFromPolicy() {
        var hostConfig = HostConfigFactory.build(policy, Path.of("/tmp/scratch"));

        assertEquals(256 * MB, hostConfig.getMemory());
        assertEquals(256 * MB, hostConfig.getMemorySwap(), "swap pinned to the memory limit");
        assertEquals(50_000L, hostConfig.getCpuQuota());
        assertEquals(100_000L, hostConfig.getCpuPeriod());
        assertEquals(64L, hostConfig.getPidsLimit());
    }

    @Test
    void tmpIsSizeBoundedAndNotExecutable() {
        var hostConfig = HostConfigFactory.build(policy, Path.of("/tmp/scratch"));

        String options = hostConfig.getTmpFs().get("/tmp");
        assertNotNull(options);
        assertTrue(options.contains("noexec"));
        assertTrue(options.contains("nosuid"));
        assertTrue(options.contains("size=" + 32 * MB));
    }

    @Test
    void scratchMountedReadOnly() {
        var hostConfig = HostConfigFactory.build(policy, Path.of("/tmp/scratch"));

        assertEquals(1, hostConfig.getBinds().length);
        var bind = hostConfig.getBinds()[0];
        assertEquals("/scratch", bind.getVolume().getPath());
        assertEquals(AccessMode.ro, bind.getAccessMode());
        assertTrue(bind.getPath().endsWith("scratch"));
    }

    @Test
    void noBindWithoutScratchDir() {
        var hostConfig = HostConfigFactory.build(policy, null);
        assertTrue(hostConfig.getBinds() == null || hostConfig.getBinds().length == 0);
    }

    @Test
    void refusesToBuildWithoutPolicy() {
        assertThrows(IllegalArgumentException.class, () -> HostConfigFactory.build(null, Path.of("/tmp")));
    }
}
