package com.aejis.sandbox;

import com.aejis.archive.ArchiveLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "aejis")
public class SandboxProperties {

    private static final long MB = 1024L * 1024;

    private Sandbox sandbox = new Sandbox();
    private Pool pool = new Pool();
    private Archive archive = new Archive();
    private Results results = new Results();

    // -- Sandbox accessors (delegate to nested) --
    public String getImage() { return sandbox.image; }
    public Duration getMaxWallTime() { return Duration.ofSeconds(sandbox.maxWallSeconds); }
    public Duration getGrace() { return Duration.ofSeconds(sandbox.graceSeconds); }
    public Duration getPollInterval() { return Duration.ofMillis(sandbox.pollIntervalMs); }
    public Duration getProbeTimeout() { return Duration.ofMillis(sandbox.probeTimeoutMs); }
    public int getMaxStdoutBytes() { return sandbox.maxStdoutBytes; }
    public int getMaxStderrBytes() { return sandbox.maxStderrBytes; }
    public Path getScratchRoot() { return Path.of(sandbox.scratchRoot); }

    // -- Pool accessors --
    public boolean isWarmEnabled() { return pool.warmEnabled; }
    public String getWarmName() { return pool.warmName; }
    public int getMaxEphemeral() { return pool.maxEphemeral; }
    public Duration getWarmRetryInterval() { return Duration.ofSeconds(pool.warmRetryIntervalSeconds); }

    // -- Results accessors --
    public Duration getResultTtl() { return Duration.ofMinutes(results.ttlMinutes); }
    public int getMaxResults() { return results.maxEntries; }

    /**
     * The configured isolation ceiling. Network, filesystem and privilege settings are
     * fixed by {@link IsolationPolicy} and cannot be configured away.
     */
    public IsolationPolicy toIsolationPolicy() {
        return IsolationPolicy.of(
                sandbox.memoryLimitMb * MB,
                sandbox.cpuQuota,
                sandbox.cpuPeriod,
                sandbox.pidsLimit,
                getMaxWallTime(),
                sandbox.tmpfsSizeMb * MB);
    }

    public ArchiveLimits toArchiveLimits() {
        return new ArchiveLimits(archive.maxEntries, archive.maxEntrySizeMb * MB,
                archive.maxTotalSizeMb * MB, archive.maxDepth);
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Archive getArchive() { return archive; }
    public void setArchive(Archive archive) { this.archive = archive; }
    public Results getResults() { return results; }
    public void setResults(Results results) { this.results = results; }

    public static class Sandbox {
        private String image = "aejis/processor:latest";
        private long memoryLimitMb = 512;
        private long cpuQuota = 100_000;
        private long cpuPeriod = 100_000;
        private long pidsLimit = 128;
        private long tmpfsSizeMb = 64;
        private int maxWallSeconds = 30;
        private int graceSeconds = 5;
        private int pollIntervalMs = 250;
        private int probeTimeoutMs = 5000;
        private int maxStdoutBytes = 8 * 1024 * 1024;
        private int maxStderrBytes = 64 * 1024;
        private String scratchRoot = System.getProperty("java.io.tmpdir") + "/aejis-scratch";

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public long getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(long memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public long getCpuQuota() { return cpuQuota; }
        public void setCpuQuota(long cpuQuota) { this.cpuQuota = cpuQuota; }
        public long getCpuPeriod() { return cpuPeriod; }
        public void setCpuPeriod(long cpuPeriod) { this.cpuPeriod = cpuPeriod; }
        public long getPidsLimit() { return pidsLimit; }
        public void setPidsLimit(long pidsLimit) { this.pidsLimit = pidsLimit; }
        public long getTmpfsSizeMb() { return tmpfsSizeMb; }
        public void setTmpfsSizeMb(long tmpfsSizeMb) { this.tmpfsSizeMb = tmpfsSizeMb; }
        public int getMaxWallSeconds() { return maxWallSeconds; }
        public void setMaxWallSeconds(int maxWallSeconds) { this.maxWallSeconds = maxWallSeconds; }
        public int getGraceSeconds() { return graceSeconds; }
        public void setGraceSeconds(int graceSeconds) { this.graceSeconds = graceSeconds; }
        public int getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(int pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public int getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(int probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
        public int getMaxStdoutBytes() { return maxStdoutBytes; }
        public void setMaxStdoutBytes(int maxStdoutBytes) { this.maxStdoutBytes = maxStdoutBytes; }
        public int getMaxStderrBytes() { return maxStderrBytes; }
        public void setMaxStderrBytes(int maxStderrBytes) { this.maxStderrBytes = maxStderrBytes; }
        public String getScratchRoot() { return scratchRoot; }
        public void setScratchRoot(String scratchRoot) { this.scratchRoot = scratchRoot; }
    }

    public static class Pool {
        private boolean warmEnabled = true;
        private String warmName = "aejis-warm-processor";
        private int maxEphemeral = 4;
        private int warmRetryIntervalSeconds = 60;

        public boolean isWarmEnabled() { return warmEnabled; }
        public void setWarmEnabled(boolean warmEnabled) { this.warmEnabled = warmEnabled; }
        public String getWarmName() { return warmName; }
        public void setWarmName(String warmName) { this.warmName = warmName; }
        public int getMaxEphemeral() { return maxEphemeral; }
        public void setMaxEphemeral(int maxEphemeral) { this.maxEphemeral = maxEphemeral; }
        public int getWarmRetryIntervalSeconds() { return warmRetryIntervalSeconds; }
        public void setWarmRetryIntervalSeconds(int warmRetryIntervalSeconds) { this.warmRetryIntervalSeconds = warmRetryIntervalSeconds; }
    }

    public static class Archive {
        private int maxEntries = 10_000;
        private long maxEntrySizeMb = 100;
        private long maxTotalSizeMb = 500;
        private int maxDepth = 3;

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
        public long getMaxEntrySizeMb() { return maxEntrySizeMb; }
        public void setMaxEntrySizeMb(long maxEntrySizeMb) { this.maxEntrySizeMb = maxEntrySizeMb; }
        public long getMaxTotalSizeMb() { return maxTotalSizeMb; }
        public void setMaxTotalSizeMb(long maxTotalSizeMb) { this.maxTotalSizeMb = maxTotalSizeMb; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    }

    public static class Results {
        private int ttlMinutes = 30;
        private int maxEntries = 1000;

        public int getTtlMinutes() { return ttlMinutes; }
        public void setTtlMinutes(int ttlMinutes) { this.ttlMinutes = ttlMinutes; }
        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }
}
