package com.aejis.core.engine;

import com.aejis.archive.ArchiveLimits;
import com.aejis.core.events.AejisEvent;
import com.aejis.core.events.EventBus;
import com.aejis.core.logging.MdcContext;
import com.aejis.core.metrics.AejisMetrics;
import com.aejis.core.model.Job;
import com.aejis.core.model.JobResult;
import com.aejis.core.model.JobState;
import com.aejis.core.model.OperationKind;
import com.aejis.core.model.ProcessingResult;
import com.aejis.core.model.ReasonCode;
import com.aejis.core.result.ResultParseException;
import com.aejis.core.result.ResultParser;
import com.aejis.core.scoring.ScoringAggregator;
import com.aejis.core.store.ResultStore;
import com.aejis.processor.Processor;
import com.aejis.processor.ProcessorRegistry;
import com.aejis.sandbox.ContainerExecutionException;
import com.aejis.sandbox.ContainerLease;
import com.aejis.sandbox.ContainerPoolManager;
import com.aejis.sandbox.ContainerTimeoutException;
import com.aejis.sandbox.ContainerUnavailableException;
import com.aejis.sandbox.HostConfigFactory;
import com.aejis.sandbox.IsolationPolicy;
import com.aejis.sandbox.PoolMembership;
import com.aejis.sandbox.SandboxProcess;
import com.aejis.sandbox.SandboxProperties;
import com.aejis.sandbox.SandboxProvider;
import com.aejis.sandbox.StagingException;
import com.aejis.sandbox.monitor.BehavioralMonitor;
import com.aejis.sandbox.monitor.JobCancellation;
import com.aejis.sandbox.monitor.SupervisionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for jobs: picks a processor, leases a sandbox container, runs the
 * processor inside it under the behavioral monitor, and turns the container output
 * into a scored {@link JobResult}.
 *
 * <p>The artifact is never parsed on the host. The only host-side look at its bytes is
 * the signature comparison the registry does on the leading bytes to choose a
 * processor id.
 *
 * <p>Every failure ends in a {@link JobResult} carrying a {@link ReasonCode}. When no
 * container runtime is available the result has {@code docker_required=true} and no
 * verdict.
 */
@Service
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    /** Launcher inside the processing image; runs {@code ProcessorMain}. */
    public static final String PROCESS_COMMAND = "aejis-process";
    static final int MAX_DIAGNOSTIC_CHARS = 4_000;

    private final ProcessorRegistry registry;
    private final ContainerPoolManager poolManager;
    private final SandboxProvider provider;
    private final BehavioralMonitor monitor;
    private final ResultParser parser;
    private final ScoringAggregator scoring;
    private final IsolationPolicy basePolicy;
    private final ArchiveLimits archiveLimits;
    private final ResultStore resultStore;
    private final AejisMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    @Autowired
    public TaskDispatcher(ProcessorRegistry registry,
                          ContainerPoolManager poolManager,
                          SandboxProvider provider,
                          BehavioralMonitor monitor,
                          ResultParser parser,
                          ScoringAggregator scoring,
                          SandboxProperties properties,
                          @Autowired(required = false) ResultStore resultStore,
                          @Autowired(required = false) AejisMetrics metrics,
                          @Autowired(required = false) EventBus eventBus) {
        this(registry, poolManager, provider, monitor, parser, scoring, properties.toIsolationPolicy(),
                properties.toArchiveLimits(), resultStore, metrics, eventBus, Clock.systemUTC());
    }

    public TaskDispatcher(ProcessorRegistry registry, ContainerPoolManager poolManager, SandboxProvider provider,
                          BehavioralMonitor monitor, ResultParser parser, ScoringAggregator scoring,
                          IsolationPolicy basePolicy, ArchiveLimits archiveLimits, ResultStore resultStore,
                          AejisMetrics metrics, EventBus eventBus, Clock clock) {
        this.registry = registry;
        this.poolManager = poolManager;
        this.provider = provider;
        this.monitor = monitor;
        this.parser = parser;
        this.scoring = scoring;
        this.basePolicy = basePolicy;
        this.archiveLimits = archiveLimits;
        this.resultStore = resultStore;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public JobResult submit(Job job) {
        return submit(job, JobCancellation.none());
    }

    /**
     * Runs one job to a terminal state. Blocks the calling thread while the job waits
     * for a container and while it runs. The policy's wall time bounds both together:
     * whatever queueing for a container used up is no longer available to the processor.
     */
    public JobResult submit(Job job, JobCancellation cancellation) {
        Instant started = clock.instant();
        Processor processor = registry.resolve(job.declaredExtension(), job.declaredMime(),
                job.header(ProcessorRegistry.HEADER_BYTES));
        MdcContext.setJob(job.id(), processor.id());
        log.info("Submitting {} to processor '{}'", job, processor.id());
        publish("job.submitted", job.id(), null, Map.of(
                "processor", processor.id(),
                "operation", job.operationKind().wireName(),
                "size", job.size()));

        ContainerLease lease = null;
        JobResult result;
        try {
            IsolationPolicy policy = basePolicy.constrainedBy(job.policyOverride());
            Instant deadline = started.plus(policy.maxWallTime());
            boolean sensitive = job.operationKind() == OperationKind.BEHAVIORAL || processor.isolationSensitive();
            lease = poolManager.acquire(policy, sensitive, remainingUntil(deadline));
            MdcContext.setContainer(lease.handle().shortId());

            poolManager.stage(lease, job.artifact());
            Duration remaining = remainingUntil(deadline);
            if (remaining.isZero()) {
                throw new ContainerTimeoutException("Wall time of " + policy.maxWallTime().toMillis()
                        + "ms used up before the processor could start", policy.maxWallTime());
            }
            SandboxProcess process = provider.execute(lease.containerId(), command(job, processor));
            SupervisionReport report = monitor.supervise(process, remaining, cancellation);
            result = interpret(job, processor, lease, report, started);
        } catch (ContainerUnavailableException e) {
            log.warn("No sandbox for job {}: {}", job.id(), e.getMessage());
            result = JobResult.dockerRequired(job, processor.id(), e.getMessage(), elapsedSince(started));
        } catch (ContainerTimeoutException e) {
            log.warn("Job {} gave up waiting for a container: {}", job.id(), e.getMessage());
            if (metrics != null) {
                metrics.recordTimeout(processor.id(), "pool_wait");
            }
            result = JobResult.timedOut(job, processor.id(), ReasonCode.WALL_TIME_EXCEEDED, null, e.getMessage(),
                    null, null, elapsedSince(started));
        } catch (StagingException e) {
            log.error("Staging failed for job {}", job.id(), e);
            markUnhealthy(lease);
            result = failed(job, processor, ReasonCode.STAGING_FAILURE, e.getMessage(), lease, started);
        } catch (ContainerExecutionException e) {
            log.error("Execution failed for job {}", job.id(), e);
            markUnhealthy(lease);
            result = failed(job, processor, ReasonCode.EXECUTION_FAILURE, e.getMessage(), lease, started);
        } catch (RuntimeException e) {
            log.error("Unexpected sandbox failure for job {}", job.id(), e);
            markUnhealthy(lease);
            result = failed(job, processor, ReasonCode.EXECUTION_FAILURE,
                    "Unexpected sandbox failure: " + e.getMessage(), lease, started);
        } finally {
            poolManager.release(lease);
        }

        try {
            complete(result);
        } finally {
            MdcContext.clear();
        }
        return result;
    }

    /** Processor invocation passed to {@code exec}. */
    List<String> command(Job job, Processor processor) {
        var command = new ArrayList<String>();
        command.add(PROCESS_COMMAND);
        command.add("--processor");
        command.add(processor.id());
        command.add("--operation");
        command.add(job.operationKind().wireName());
        command.add("--input");
        command.add(HostConfigFactory.SCRATCH_INPUT);
        if (!job.declaredExtension().isEmpty()) {
            command.add("--extension");
            command.add(job.declaredExtension());
        }
        if (job.declaredMime() != null && !job.declaredMime().isBlank()) {
            command.add("--mime");
            command.add(job.declaredMime());
        }
        command.add("--max-entries");
        command.add(String.valueOf(archiveLimits.maxEntries()));
        command.add("--max-entry-size");
        command.add(String.valueOf(archiveLimits.maxEntrySize()));
        command.add("--max-total-size");
        command.add(String.valueOf(archiveLimits.maxTotalSize()));
        command.add("--max-depth");
        command.add(String.valueOf(archiveLimits.maxDepth()));
        return command;
    }

    private JobResult interpret(Job job, Processor processor, ContainerLease lease, SupervisionReport report,
                                Instant started) {
        String containerId = lease.containerId();
        PoolMembership membership = lease.handle().membership();

        if (report.state() == JobState.TIMED_OUT) {
            lease.markUnhealthy();
            ReasonCode reason = report.reason() == SupervisionReport.Reason.CANCELLED
                    ? ReasonCode.CANCELLED : ReasonCode.WALL_TIME_EXCEEDED;
            if (metrics != null) {
                metrics.recordTimeout(processor.id(), reason == ReasonCode.CANCELLED ? "cancelled" : "wall_time");
            }
            ProcessingResult partial = tryParsePartial(report.stdout());
            String diagnostic = (reason == ReasonCode.CANCELLED ? "Cancelled" : "Wall time exceeded")
                    + " after " + report.elapsed().toMillis() + "ms; container force-killed"
                    + stderrSuffix(report.stderr());
            log.warn("Job {} {} after {}ms", job.id(), reason, report.elapsed().toMillis());
            return JobResult.timedOut(job, processor.id(), reason, partial, diagnostic, containerId, membership,
                    elapsedSince(started));
        }

        if (!report.completed()) {
            ReasonCode reason = switch (report.reason()) {
                case NO_OUTPUT -> ReasonCode.NO_OUTPUT;
                case MONITOR_ERROR -> {
                    lease.markUnhealthy();
                    yield ReasonCode.EXECUTION_FAILURE;
                }
                default -> ReasonCode.EXECUTION_FAILURE;
            };
            log.warn("Job {} failed in container: {} (exit {})", job.id(), report.reason(), report.exitCode());
            if (log.isDebugEnabled() && !report.stderr().isEmpty()) {
                log.debug("Container stderr for {}: {}", job.id(), truncate(report.stderr()));
            }
            String diagnostic = "Processor exited with " + report.reason() + " (exit code " + report.exitCode() + ")"
                    + stderrSuffix(report.stderr());
            return failed(job, processor, reason, diagnostic, lease, started);
        }

        ProcessingResult parsed;
        try {
            parsed = parser.parse(report.stdout());
        } catch (ResultParseException e) {
            if (metrics != null) {
                metrics.recordResultParseFailure();
            }
            log.warn("Job {}: {}", job.id(), e.getMessage());
            return failed(job, processor, ReasonCode.RESULT_PARSE_FAILURE, e.getMessage(), lease, started);
        }

        ProcessingResult scored = scoring.rescore(parsed).withSecureProcessing(true);
        if (!scored.success()) {
            boolean archiveLimit = "ARCHIVE_LIMIT_EXCEEDED".equals(scored.errorCode());
            if (archiveLimit && metrics != null) {
                metrics.recordArchiveRejection();
            }
            return JobResult.processorFailed(job, processor.id(),
                    archiveLimit ? ReasonCode.ARCHIVE_LIMIT_EXCEEDED : ReasonCode.PROCESSOR_FAILURE,
                    scored, containerId, membership, elapsedSince(started));
        }
        return JobResult.completed(job, processor.id(), scored, containerId, membership, elapsedSince(started));
    }

    private ProcessingResult tryParsePartial(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        try {
            return scoring.rescore(parser.parse(stdout)).withSecureProcessing(true);
        } catch (ResultParseException e) {
            log.debug("No result in partial output: {}", e.getMessage());
            return null;
        }
    }

    private JobResult failed(Job job, Processor processor, ReasonCode reason, String diagnostic,
                             ContainerLease lease, Instant started) {
        return JobResult.failed(job, processor.id(), reason, diagnostic,
                lease != null ? lease.containerId() : null,
                lease != null ? lease.handle().membership() : null,
                elapsedSince(started));
    }

    private void complete(JobResult result) {
        if (resultStore != null) {
            resultStore.put(result);
        }
        String outcome = result.dockerRequired() ? "docker_required" : result.state().name().toLowerCase();
        if (metrics != null) {
            metrics.recordJob(result.processor(), outcome, result.elapsedMs());
            if (result.verdictAvailable()) {
                metrics.recordBehavioralScore(result.processor(), result.behavioralScore());
            }
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("state", result.state().name());
        payload.put("reason", result.reason().name());
        payload.put("docker_required", result.dockerRequired());
        if (result.result() != null) {
            payload.put("behavioral_score", result.result().behavioralScore());
        }
        String eventType = switch (result.state()) {
            case COMPLETED -> "job.completed";
            case TIMED_OUT -> "job.timed_out";
            default -> "job.failed";
        };
        publish(eventType, result.jobId(), result.containerId(), payload);
        log.info("Job {} {} ({}) in {}ms{}", result.jobId(), result.state(), result.reason(), result.elapsedMs(),
                result.result() != null ? ", score " + result.result().behavioralScore() : "");
    }

    private static void markUnhealthy(ContainerLease lease) {
        if (lease != null) {
            lease.markUnhealthy();
        }
    }

    private Duration remainingUntil(Instant deadline) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }

    private void publish(String type, String jobId, String containerId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(AejisEvent.of(type, jobId, containerId, payload));
        }
    }

    private static String stderrSuffix(String stderr) {
        return stderr == null || stderr.isBlank() ? "" : "; stderr: " + truncate(stderr.strip());
    }

    /** Keeps head and tail of container output for diagnostics. */
    static String truncate(String output) {
        if (output == null || output.length() <= MAX_DIAGNOSTIC_CHARS) return output;
        int half = MAX_DIAGNOSTIC_CHARS / 2;
        return output.substring(0, half)
                + "\n\n... [truncated " + (output.length() - MAX_DIAGNOSTIC_CHARS) + " chars] ...\n\n"
                + output.substring(output.length() - half);
    }
}
