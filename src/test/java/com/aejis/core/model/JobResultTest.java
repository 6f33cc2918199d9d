package com.aejis.core.model;

import com.aejis.sandbox.PoolMembership;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JobResultTest {

    private final Job job = Job.of(new byte[]{1}, "a.txt", OperationKind.PREVIEW);

    @Test
    void completedCarriesVerdict() {
        var result = JobResult.completed(job, "text", ProcessingResult.builder("text").build(), "abc",
                PoolMembership.WARM, Duration.ofMillis(40));

        assertTrue(result.verdictAvailable());
        assertEquals(100, result.behavioralScore());
        assertEquals(40, result.elapsedMs());
    }

    @Test
    @DisplayName("docker_required never carries a verdict")
    void dockerRequiredHasNoVerdict() {
        var result = JobResult.dockerRequired(job, "text", "daemon unreachable", Duration.ZERO);

        assertFalse(result.verdictAvailable());
        assertFalse(result.secureProcessing());
        assertTrue(result.dockerRequired());
        assertEquals(ReasonCode.DOCKER_REQUIRED, result.reason());
        assertEquals(0, result.behavioralScore());
    }

    @Test
    void processorFailureKeepsSandboxedResult() {
        var failure = ProcessingResult.failure("pdf", "bad xref", "MALFORMED");

        var result = JobResult.processorFailed(job, "pdf", ReasonCode.EXECUTION_FAILURE, failure, "abc",
                PoolMembership.EPHEMERAL, Duration.ZERO);

        assertFalse(result.verdictAvailable());
        assertEquals("bad xref", result.diagnostic());
        assertSame(failure, result.result());
    }

    @Test
    void timedOutIsNeverAVerdict() {
        var partial = ProcessingResult.builder("text").build();

        var result = JobResult.timedOut(job, "text", ReasonCode.WALL_TIME_EXCEEDED, partial, "killed",
                "abc", PoolMembership.WARM, Duration.ofSeconds(30));

        assertEquals(JobState.TIMED_OUT, result.state());
        assertFalse(result.verdictAvailable());
    }
}
