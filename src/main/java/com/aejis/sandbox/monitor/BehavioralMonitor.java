package com.aejis.sandbox.monitor;

import com.aejis.core.model.JobState;
import com.aejis.sandbox.SandboxProcess;
import com.aejis.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock supervision of a running processor.
 *
 * <p>State machine: {@code PENDING -> RUNNING -> {COMPLETED | TIMED_OUT | FAILED}}.
 * While running, the process is polled at a fixed interval. Once the budget is spent it
 * is killed (never stopped gracefully) and the job ends {@code TIMED_OUT} with whatever
 * output it produced so far. Caller cancellation takes the same path with reason
 * {@link SupervisionReport.Reason#CANCELLED}. {@code COMPLETED} requires exit code 0 and
 * non-empty stdout.
 *
 * <p>Everything after the deadline (kill, draining output) shares one grace interval,
 * so a job never outlives {@code maxWallTime + pollInterval + grace}.
 */
@Component
public class BehavioralMonitor {

    private static final Logger log = LoggerFactory.getLogger(BehavioralMonitor.class);

    private final Duration pollInterval;
    private final Duration grace;
    private final Clock clock;

    @Autowired
    public BehavioralMonitor(SandboxProperties properties) {
        this(properties.getPollInterval(), properties.getGrace(), Clock.systemUTC());
    }

    public BehavioralMonitor(Duration pollInterval, Duration grace, Clock clock) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
        this.grace = grace;
        this.clock = clock;
    }

    public Duration grace() {
        return grace;
    }

    public SupervisionReport supervise(SandboxProcess process, Duration maxWallTime, JobCancellation cancellation) {
        Instant start = clock.instant();
        Instant deadline = start.plus(maxWallTime);
        log.debug("Supervising process in {} (budget {}ms)", process.containerId(), maxWallTime.toMillis());

        while (true) {
            if (cancellation != null && cancellation.isCancelled()) {
                log.info("Job cancelled by caller; killing process in {}", process.containerId());
                return terminate(process, start, SupervisionReport.Reason.CANCELLED);
            }

            boolean running;
            try {
                running = process.isRunning();
            } catch (RuntimeException e) {
                log.error("Lost track of process in {}: {}", process.containerId(), e.getMessage());
                boolean killed = forceKill(process);
                return report(JobState.FAILED, SupervisionReport.Reason.MONITOR_ERROR, null,
                        process, killed, start);
            }
            if (!running) {
                break;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                log.warn("Process in {} exceeded wall time of {}ms; killing",
                        process.containerId(), maxWallTime.toMillis());
                return terminate(process, start, SupervisionReport.Reason.WALL_TIME_EXCEEDED);
            }

            Duration remaining = Duration.between(now, deadline);
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining.toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Supervisor interrupted; killing process in {}", process.containerId());
                return terminate(process, start, SupervisionReport.Reason.CANCELLED);
            }
        }

        Integer exitCode;
        String stdout;
        try {
            process.awaitOutput(grace);
            exitCode = process.exitCode();
            stdout = process.stdout();
        } catch (RuntimeException e) {
            log.error("Lost track of finished process in {}: {}", process.containerId(), e.getMessage());
            return report(JobState.FAILED, SupervisionReport.Reason.MONITOR_ERROR, null, process, false, start);
        }

        if (exitCode == null || exitCode != 0) {
            log.warn("Process in {} exited with code {}", process.containerId(), exitCode);
            return report(JobState.FAILED, SupervisionReport.Reason.NON_ZERO_EXIT, exitCode, process, false, start);
        }
        if (stdout == null || stdout.isBlank()) {
            log.warn("Process in {} exited cleanly but produced no output", process.containerId());
            return report(JobState.FAILED, SupervisionReport.Reason.NO_OUTPUT, exitCode, process, false, start);
        }
        return report(JobState.COMPLETED, SupervisionReport.Reason.NONE, exitCode, process, false, start);
    }

    private SupervisionReport terminate(SandboxProcess process, Instant start, SupervisionReport.Reason reason) {
        Instant killStart = clock.instant();
        boolean killed = forceKill(process);
        Duration left = grace.minus(Duration.between(killStart, clock.instant()));
        if (!left.isNegative() && !left.isZero()) {
            try {
                process.awaitOutput(left);
            } catch (RuntimeException e) {
                log.warn("Draining output of killed process in {} failed: {}", process.containerId(), e.getMessage());
            }
        }
        return report(JobState.TIMED_OUT, reason, null, process, killed, start);
    }

    private boolean forceKill(SandboxProcess process) {
        try {
            process.kill();
            return true;
        } catch (RuntimeException e) {
            log.error("Force kill of process in {} failed: {}", process.containerId(), e.getMessage(), e);
            return false;
        }
    }

    private SupervisionReport report(JobState state, SupervisionReport.Reason reason, Integer exitCode,
                                     SandboxProcess process, boolean killed, Instant start) {
        return new SupervisionReport(state, reason, exitCode, read(process, true),
                read(process, false), killed, Duration.between(start, clock.instant()));
    }

    /** Buffered output, or empty if even that cannot be reached. */
    private static String read(SandboxProcess process, boolean stdout) {
        try {
            String s = stdout ? process.stdout() : process.stderr();
            return s != null ? s : "";
        } catch (RuntimeException e) {
            log.debug("Output of process in {} unreadable: {}", process.containerId(), e.getMessage());
            return "";
        }
    }
}
