package com.aejis.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider.
 *
 * <p>Each container is created with:
 * <ul>
 *   <li>The host configuration from {@link HostConfigFactory} (no network, read-only
 *       rootfs, no new privileges, all capabilities dropped, resource ceilings)</li>
 *   <li>The per-handle scratch directory bind-mounted read-only at /scratch</li>
 *   <li>A keep-alive command; processors run through {@code docker exec}</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    private static final long PROBE_POLL_MS = 50;

    private final DockerClient dockerClient;
    private final int maxStdoutBytes;
    private final int maxStderrBytes;

    public DockerSandboxProvider(DockerClient dockerClient, int maxStdoutBytes, int maxStderrBytes) {
        this.dockerClient = dockerClient;
        this.maxStdoutBytes = maxStdoutBytes;
        this.maxStderrBytes = maxStderrBytes;
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String createContainer(ContainerSpec spec) {
        var hostConfig = HostConfigFactory.build(spec.policy(), spec.scratchDir());
        try {
            var response = dockerClient.createContainerCmd(spec.image())
                    .withName(spec.name())
                    .withLabels(spec.labels())
                    .withHostConfig(hostConfig)
                    .withNetworkDisabled(true)
                    .withCmd(spec.command())
                    .exec();
            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Container {} started ({})", spec.name(), containerId);
            return containerId;
        } catch (RuntimeException e) {
            throw new ContainerUnavailableException("Failed to create container " + spec.name(), e);
        }
    }

    @Override
    public Optional<String> findContainer(String name) {
        List<Container> containers;
        try {
            containers = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withNameFilter(List.of(name))
                    .exec();
        } catch (RuntimeException e) {
            throw new ContainerUnavailableException("Failed to look up container " + name, e);
        }
        // The name filter matches substrings; docker prefixes names with '/'
        return containers.stream()
                .filter(c -> c.getNames() != null && List.of(c.getNames()).contains("/" + name))
                .map(Container::getId)
                .findFirst();
    }

    @Override
    public boolean isRunning(String containerId) {
        try {
            InspectContainerResponse inspect = dockerClient.inspectContainerCmd(containerId).exec();
            return inspect.getState() != null && Boolean.TRUE.equals(inspect.getState().getRunning());
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            throw new ContainerUnavailableException("Failed to inspect container " + containerId, e);
        }
    }

    @Override
    public SandboxProcess execute(String containerId, List<String> command) {
        try {
            var exec = dockerClient.execCreateCmd(containerId)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withCmd(command.toArray(new String[0]))
                    .exec();
            var output = new CappedOutputCallback(maxStdoutBytes, maxStderrBytes);
            dockerClient.execStartCmd(exec.getId()).exec(output);
            log.debug("Exec {} started in container {}", exec.getId(), containerId);
            return new DockerExecProcess(containerId, exec.getId(), output);
        } catch (RuntimeException e) {
            throw new ContainerExecutionException("Failed to exec in container " + containerId, e);
        }
    }

    @Override
    public boolean probe(String containerId, Duration timeout) {
        return run(containerId, List.of("true"), timeout);
    }

    @Override
    public boolean run(String containerId, List<String> command, Duration timeout) {
        SandboxProcess process;
        try {
            process = execute(containerId, command);
        } catch (ContainerExecutionException e) {
            log.warn("Command {} could not start in {}: {}", command.get(0), containerId, e.getMessage());
            return false;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (System.nanoTime() < deadline) {
                if (!process.isRunning()) {
                    Integer code = process.exitCode();
                    return code != null && code == 0;
                }
                Thread.sleep(PROBE_POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            log.warn("Command {} failed in {}: {}", command.get(0), containerId, e.getMessage());
            return false;
        }
        log.warn("Command {} timed out after {}ms in {}", command.get(0), timeout.toMillis(), containerId);
        return false;
    }

    @Override
    public void kill(String containerId) {
        try {
            dockerClient.killContainerCmd(containerId).withSignal("KILL").exec();
            log.info("Container {} killed", containerId);
        } catch (NotFoundException | ConflictException | NotModifiedException e) {
            log.debug("Container {} already gone or stopped: {}", containerId, e.getMessage());
        } catch (RuntimeException e) {
            throw new ContainerExecutionException("Failed to kill container " + containerId, e);
        }
    }

    @Override
    public void remove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).withRemoveVolumes(true).exec();
            log.info("Container {} removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (RuntimeException e) {
            throw new SandboxException("Failed to remove container " + containerId, e);
        }
    }

    @Override
    public List<String> listByLabel(String key, String value) {
        try {
            return dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(Map.of(key, value))
                    .exec()
                    .stream()
                    .map(Container::getId)
                    .toList();
        } catch (RuntimeException e) {
            throw new ContainerUnavailableException("Failed to list containers labelled " + key + "=" + value, e);
        }
    }

    /**
     * Collects exec output into two bounded buffers. Frames past the cap are dropped,
     * so a processor flooding stdout cannot exhaust host memory.
     */
    static final class CappedOutputCallback extends ResultCallback.Adapter<Frame> {

        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        private final int maxStdout;
        private final int maxStderr;
        private boolean truncated;

        CappedOutputCallback(int maxStdout, int maxStderr) {
            this.maxStdout = maxStdout;
            this.maxStderr = maxStderr;
        }

        @Override
        public void onNext(Frame frame) {
            byte[] payload = frame.getPayload();
            if (payload == null) {
                return;
            }
            synchronized (this) {
                if (frame.getStreamType() == StreamType.STDERR) {
                    append(stderr, payload, maxStderr);
                } else {
                    append(stdout, payload, maxStdout);
                }
            }
        }

        private void append(ByteArrayOutputStream target, byte[] payload, int cap) {
            int room = cap - target.size();
            if (room <= 0) {
                truncated = true;
                return;
            }
            int n = Math.min(room, payload.length);
            target.write(payload, 0, n);
            if (n < payload.length) {
                truncated = true;
            }
        }

        synchronized String stdout() {
            return stdout.toString(StandardCharsets.UTF_8);
        }

        synchronized String stderr() {
            return stderr.toString(StandardCharsets.UTF_8);
        }

        synchronized boolean truncated() {
            return truncated;
        }
    }

    private final class DockerExecProcess implements SandboxProcess {

        private final String containerId;
        private final String execId;
        private final CappedOutputCallback output;

        DockerExecProcess(String containerId, String execId, CappedOutputCallback output) {
            this.containerId = containerId;
            this.execId = execId;
            this.output = output;
        }

        @Override
        public String containerId() {
            return containerId;
        }

        @Override
        public boolean isRunning() {
            return Boolean.TRUE.equals(inspect().isRunning());
        }

        @Override
        public Integer exitCode() {
            InspectExecResponse inspect = inspect();
            if (Boolean.TRUE.equals(inspect.isRunning())) {
                return null;
            }
            Long code = inspect.getExitCodeLong();
            return code != null ? code.intValue() : null;
        }

        private InspectExecResponse inspect() {
            try {
                return dockerClient.inspectExecCmd(execId).exec();
            } catch (RuntimeException e) {
                throw new ContainerUnavailableException("Lost track of exec " + execId + " in " + containerId, e);
            }
        }

        @Override
        public void awaitOutput(Duration timeout) {
            try {
                if (!output.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.debug("Output of exec {} still streaming after {}ms", execId, timeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (output.truncated()) {
                log.warn("Output of exec {} exceeded the buffer cap and was truncated", execId);
            }
        }

        @Override
        public String stdout() {
            return output.stdout();
        }

        @Override
        public String stderr() {
            return output.stderr();
        }

        @Override
        public void kill() {
            // docker has no exec-level kill; the whole container goes
            DockerSandboxProvider.this.kill(containerId);
            try {
                output.close();
            } catch (IOException e) {
                log.debug("Closing output stream of exec {} failed: {}", execId, e.getMessage());
            }
        }
    }
}
