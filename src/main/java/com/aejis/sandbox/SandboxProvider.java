package com.aejis.sandbox;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the container runtime.
 * Implementation: {@link DockerSandboxProvider}.
 */
public interface SandboxProvider {

    /** Cheap reachability check of the container runtime. */
    boolean isAvailable();

    /**
     * Creates and starts a container. The host configuration is always derived from
     * {@link ContainerSpec#policy()} via {@link HostConfigFactory}.
     *
     * @return the container id
     * @throws ContainerUnavailableException if the runtime refuses or cannot be reached
     */
    String createContainer(ContainerSpec spec);

    /**
     * Looks up a container id by name.
     *
     * @throws ContainerUnavailableException if the runtime cannot be reached
     */
    Optional<String> findContainer(String name);

    /**
     * @return false if the container is stopped or unknown
     * @throws ContainerUnavailableException if the runtime cannot be reached
     */
    boolean isRunning(String containerId);

    /**
     * Starts a command inside a running container and returns immediately.
     *
     * @throws ContainerExecutionException if the exec cannot be created or started
     */
    SandboxProcess execute(String containerId, List<String> command);

    /**
     * Health probe: runs a no-op command and checks it exits 0 within the timeout.
     */
    boolean probe(String containerId, Duration timeout);

    /**
     * Runs a command to completion inside a running container.
     *
     * @return true only if the command exited 0 within the timeout
     */
    boolean run(String containerId, List<String> command, Duration timeout);

    /** SIGKILL, never a graceful stop. */
    void kill(String containerId);

    void remove(String containerId);

    /** Ids of all containers carrying the given label, running or not. */
    List<String> listByLabel(String key, String value);
}
