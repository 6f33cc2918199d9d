package com.aejis.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sandboxed job execution.
 */
@Service
public class AejisMetrics {

    private final MeterRegistry registry;

    public AejisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJob(String processor, String outcome, long ms) {
        Timer.builder("aejis.job.duration")
                .tag("processor", processor)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("aejis.jobs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordBehavioralScore(String processor, int score) {
        DistributionSummary.builder("aejis.job.behavioral_score")
                .tag("processor", processor)
                .register(registry)
                .record(score);
    }

    /**
     * Records a job killed at its wall-clock boundary.
     *
     * @param reason "wall_time", "cancelled" or "pool_wait"
     */
    public void recordTimeout(String processor, String reason) {
        Counter.builder("aejis.job.timeouts")
                .description("Jobs force-killed by the behavioral monitor")
                .tag("processor", processor)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordResultParseFailure() {
        Counter.builder("aejis.result.parse_failures")
                .description("Container outputs with no recoverable JSON object")
                .register(registry)
                .increment();
    }

    public void recordArchiveRejection() {
        Counter.builder("aejis.archive.rejections")
                .description("Archives aborted for crossing an expansion limit")
                .register(registry)
                .increment();
    }

    // --- Pool ---

    /**
     * @param membership "warm" or "ephemeral"
     */
    public void recordContainerAcquired(String membership) {
        Counter.builder("aejis.pool.acquisitions")
                .tag("membership", membership)
                .register(registry)
                .increment();
    }

    public void recordWarmRecreation(boolean success) {
        Counter.builder("aejis.pool.warm_recreations")
                .description("Warm container destroy-and-recreate attempts")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * @param mode the mode the pool degraded to
     */
    public void recordPoolDegraded(String mode) {
        Counter.builder("aejis.pool.degradations")
                .description("Switches away from the warm container")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }
}
