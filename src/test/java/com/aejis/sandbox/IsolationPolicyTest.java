package com.aejis.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IsolationPolicyTest {

    private static final long MB = 1024L * 1024;

    @Nested
    @DisplayName("Fixed isolation fields")
    class FixedFields {

        @Test
        @DisplayName("rejects any network mode other than none")
        void rejectsBridgeNetwork() {
            var ex = assertThrows(IllegalArgumentException.class, () -> new IsolationPolicy(
                    512 * MB, 100_000, 100_000, 64, "bridge", IsolationPolicy.FS_READ_ONLY,
                    List.of(IsolationPolicy.NO_NEW_PRIVILEGES), Duration.ofSeconds(30), 64 * MB));
            assertTrue(ex.getMessage().contains("bridge"));
        }

        @Test
        @DisplayName("rejects a writable root filesystem")
        void rejectsWritableFilesystem() {
            assertThrows(IllegalArgumentException.class, () -> new IsolationPolicy(
                    512 * MB, 100_000, 100_000, 64, IsolationPolicy.NETWORK_NONE, "read_write",
                    List.of(IsolationPolicy.NO_NEW_PRIVILEGES), Duration.ofSeconds(30), 64 * MB));
        }

        @Test
        @DisplayName("requires no-new-privileges")
        void requiresNoNewPrivileges() {
            assertThrows(IllegalArgumentException.class, () -> new IsolationPolicy(
                    512 * MB, 100_000, 100_000, 64, IsolationPolicy.NETWORK_NONE, IsolationPolicy.FS_READ_ONLY,
                    List.of("seccomp=unconfined"), Duration.ofSeconds(30), 64 * MB));
        }

        @Test
        @DisplayName("rejects non-positive limits and wall time")
        void rejectsNonPositiveLimits() {
            assertThrows(IllegalArgumentException.class,
                    () -> IsolationPolicy.of(0, 100_000, 100_000, 64, Duration.ofSeconds(30), 64 * MB));
            assertThrows(IllegalArgumentException.class,
                    () -> IsolationPolicy.of(512 * MB, 100_000, 100_000, 64, Duration.ZERO, 64 * MB));
        }

        @Test
        void defaultsAreLockedDown() {
            var policy = IsolationPolicy.defaults();
            assertEquals("none", policy.networkMode());
            assertEquals("read_only", policy.filesystemMode());
            assertTrue(policy.securityOpts().contains("no-new-privileges:true"));
        }
    }

    @Nested
    @DisplayName("constrainedBy")
    class ConstrainedBy {

        private final IsolationPolicy base = IsolationPolicy.of(
                512 * MB, 100_000, 100_000, 128, Duration.ofSeconds(30), 64 * MB);

        @Test
        void nullOverrideKeepsBase() {
            assertSame(base, base.constrainedBy(null));
        }

        @Test
        @DisplayName("override can only tighten limits")
        void overrideOnlyTightens() {
            var override = IsolationPolicy.of(2048 * MB, 400_000, 100_000, 32, Duration.ofSeconds(5), 16 * MB);

            var effective = base.constrainedBy(override);

            assertEquals(512 * MB, effective.memoryLimitBytes());
            assertEquals(100_000, effective.cpuQuota());
            assertEquals(32, effective.pidsLimit());
            assertEquals(Duration.ofSeconds(5), effective.maxWallTime());
            assertEquals(16 * MB, effective.tmpfsSizeBytes());
            assertEquals("none", effective.networkMode());
        }

        @Test
        @DisplayName("smaller cpu share wins as a quota/period pair")
        void cpuShareComparedAsRatio() {
            var override = IsolationPolicy.of(512 * MB, 25_000, 50_000, 128, Duration.ofSeconds(30), 64 * MB);

            var effective = base.constrainedBy(override);

            assertEquals(25_000, effective.cpuQuota());
            assertEquals(50_000, effective.cpuPeriod());
        }
    }
}
