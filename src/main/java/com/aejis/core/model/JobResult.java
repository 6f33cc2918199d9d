package com.aejis.core.model;

import com.aejis.sandbox.PoolMembership;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Outbound result of one job: the canonical {@link ProcessingResult} (absent when no
 * verdict could be produced) plus the flags and reason code the caller must honor.
 *
 * <p>{@code dockerRequired=true} means "no verdict available". Callers must not fall
 * back to parsing the artifact themselves. Likewise {@code secureProcessing=false}
 * never means the same as {@code true}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("file_name") String fileName,
    @JsonProperty("state") JobState state,
    @JsonProperty("reason") ReasonCode reason,
    @JsonProperty("result") ProcessingResult result,
    @JsonProperty("secure_processing") boolean secureProcessing,
    @JsonProperty("docker_required") boolean dockerRequired,
    @JsonProperty("processor") String processor,
    @JsonProperty("container_id") String containerId,
    @JsonProperty("pool_membership") PoolMembership membership,
    @JsonProperty("elapsed_ms") long elapsedMs,
    @JsonProperty("diagnostic") String diagnostic,
    @JsonProperty("completed_at") Instant completedAt
) {

    public static JobResult dockerRequired(Job job, String processor, String diagnostic, Duration elapsed) {
        return new JobResult(job.id(), job.fileName(), JobState.FAILED, ReasonCode.DOCKER_REQUIRED, null,
                false, true, processor, null, null, elapsed.toMillis(), diagnostic, Instant.now());
    }

    public static JobResult failed(Job job, String processor, ReasonCode reason, String diagnostic,
                                   String containerId, PoolMembership membership, Duration elapsed) {
        return new JobResult(job.id(), job.fileName(), JobState.FAILED, reason, null, false, false,
                processor, containerId, membership, elapsed.toMillis(), diagnostic, Instant.now());
    }

    /**
     * The sandboxed processor ran and reported {@code success=false}. Its result is
     * attached because it was produced inside the sandbox.
     */
    public static JobResult processorFailed(Job job, String processor, ReasonCode reason, ProcessingResult result,
                                            String containerId, PoolMembership membership, Duration elapsed) {
        return new JobResult(job.id(), job.fileName(), JobState.FAILED, reason, result, result.secureProcessing(),
                false, processor, containerId, membership, elapsed.toMillis(), result.error(), Instant.now());
    }

    public static JobResult completed(Job job, String processor, ProcessingResult result, String containerId,
                                      PoolMembership membership, Duration elapsed) {
        return new JobResult(job.id(), job.fileName(), JobState.COMPLETED, ReasonCode.NONE, result,
                result.secureProcessing(), false, processor, containerId, membership, elapsed.toMillis(), null,
                Instant.now());
    }

    /**
     * Killed at the wall-time boundary or by the caller. {@code partial} is whatever result
     * could be recovered from the output produced before the kill, possibly null; it is
     * never a verdict.
     */
    public static JobResult timedOut(Job job, String processor, ReasonCode reason, ProcessingResult partial,
                                     String diagnostic, String containerId, PoolMembership membership,
                                     Duration elapsed) {
        return new JobResult(job.id(), job.fileName(), JobState.TIMED_OUT, reason, partial, false, false,
                processor, containerId, membership, elapsed.toMillis(), diagnostic, Instant.now());
    }

    /** A verdict exists only when a sandboxed processor reported success and docker was present. */
    @JsonIgnore
    public boolean verdictAvailable() {
        return !dockerRequired && secureProcessing && result != null && result.success()
                && state == JobState.COMPLETED;
    }

    @JsonIgnore
    public int behavioralScore() {
        return result != null ? result.behavioralScore() : 0;
    }
}
