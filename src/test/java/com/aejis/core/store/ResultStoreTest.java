package com.aejis.core.store;

import com.aejis.core.model.Job;
import com.aejis.core.model.JobResult;
import com.aejis.core.model.OperationKind;
import com.aejis.core.model.ReasonCode;
import com.aejis.sandbox.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResultStoreTest {

    private MutableClock clock;
    private ResultStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        store = new ResultStore(Duration.ofMinutes(30), 3, clock);
    }

    private JobResult result(String jobId) {
        Job job = new Job(jobId, new byte[]{1}, "f.bin", ".bin", null, OperationKind.PREVIEW, null);
        return JobResult.failed(job, "binary", ReasonCode.EXECUTION_FAILURE, "exit 1", null, null, Duration.ZERO);
    }

    @Test
    void putAndGet() {
        store.put(result("JOB-1"));

        assertTrue(store.get("JOB-1").isPresent());
        assertTrue(store.get("JOB-2").isEmpty());
    }

    @Test
    void expiredEntriesAreInvisible() {
        store.put(result("JOB-1"));
        clock.advance(Duration.ofMinutes(31));

        assertTrue(store.get("JOB-1").isEmpty());
        assertEquals(0, store.size(), "expired entry dropped on read");
    }

    @Test
    void scheduledEvictionRemovesOnlyExpired() {
        store.put(result("JOB-1"));
        clock.advance(Duration.ofMinutes(20));
        store.put(result("JOB-2"));
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, store.evictExpired());
        assertTrue(store.get("JOB-2").isPresent());
        assertEquals(1, store.size());
    }

    @Test
    void capacityEvictsOldest() {
        store.put(result("JOB-1"));
        clock.advance(Duration.ofSeconds(1));
        store.put(result("JOB-2"));
        clock.advance(Duration.ofSeconds(1));
        store.put(result("JOB-3"));
        clock.advance(Duration.ofSeconds(1));
        store.put(result("JOB-4"));

        assertEquals(3, store.size());
        assertTrue(store.get("JOB-1").isEmpty());
        assertTrue(store.get("JOB-4").isPresent());
    }

    @Test
    void recentIsNewestFirst() {
        store.put(result("JOB-1"));
        clock.advance(Duration.ofSeconds(5));
        store.put(result("JOB-2"));

        assertEquals("JOB-2", store.recent().get(0).jobId());
        assertEquals(2, store.recent().size());
    }

    @Test
    void removeReturnsEntry() {
        store.put(result("JOB-1"));

        assertEquals("JOB-1", store.remove("JOB-1").orElseThrow().jobId());
        assertTrue(store.remove("JOB-1").isEmpty());
    }
}
