package com.aejis.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link SandboxProvider} needs to create one container.
 *
 * @param name       container name
 * @param image      processing image reference
 * @param labels     docker labels, used to find pool containers again
 * @param policy     isolation policy; applied through {@link HostConfigFactory}
 * @param scratchDir host directory bind-mounted read-only at {@link HostConfigFactory#SCRATCH_MOUNT}
 * @param command    keep-alive command; jobs run via exec
 */
public record ContainerSpec(
    String name,
    String image,
    Map<String, String> labels,
    IsolationPolicy policy,
    Path scratchDir,
    List<String> command
) {
    public ContainerSpec {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
        command = command != null ? List.copyOf(command) : List.of();
    }
}
