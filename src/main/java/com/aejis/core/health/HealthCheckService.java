package com.aejis.core.health;

import com.aejis.processor.ProcessorRegistry;
import com.aejis.sandbox.ContainerPoolManager;
import com.aejis.sandbox.PoolSnapshot;
import com.aejis.sandbox.SandboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProvider sandboxProvider;
    private final ContainerPoolManager poolManager;
    private final ProcessorRegistry processorRegistry;

    public HealthCheckService(
            @Autowired(required = false) SandboxProvider sandboxProvider,
            @Autowired(required = false) ContainerPoolManager poolManager,
            @Autowired(required = false) ProcessorRegistry processorRegistry) {
        this.sandboxProvider = sandboxProvider;
        this.poolManager = poolManager;
        this.processorRegistry = processorRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkPool());
        results.add(checkProcessors());
        return results;
    }

    private HealthStatus checkDocker() {
        if (sandboxProvider == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No sandbox provider configured", Map.of());
        }
        try {
            if (sandboxProvider.isAvailable()) {
                return new HealthStatus("docker", HealthStatus.Status.UP,
                        "Container runtime reachable", Map.of());
            }
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Container runtime unreachable; jobs return docker_required", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker check failed: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkPool() {
        if (poolManager == null) {
            return new HealthStatus("pool", HealthStatus.Status.DOWN, "Pool manager not available", Map.of());
        }
        PoolSnapshot snapshot = poolManager.snapshot();
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("mode", snapshot.mode().name());
        metadata.put("ephemeral_in_flight", snapshot.ephemeralInFlight() + "/" + snapshot.ephemeralCapacity());
        if (snapshot.warmContainerId() != null) {
            metadata.put("warm_container", snapshot.warmContainerId());
            metadata.put("warm_status", String.valueOf(snapshot.warmStatus()));
        }
        return switch (snapshot.mode()) {
            case WARM -> new HealthStatus("pool", HealthStatus.Status.UP, "Warm container in service", metadata);
            case EPHEMERAL_ONLY -> new HealthStatus("pool", HealthStatus.Status.DEGRADED,
                    "Warm container unavailable, running ephemeral only", metadata);
            case DOCKER_REQUIRED -> new HealthStatus("pool", HealthStatus.Status.DOWN,
                    "Container runtime required", metadata);
        };
    }

    private HealthStatus checkProcessors() {
        if (processorRegistry == null) {
            return new HealthStatus("processors", HealthStatus.Status.DOWN, "No processor registry", Map.of());
        }
        int count = processorRegistry.all().size();
        return new HealthStatus("processors", HealthStatus.Status.UP,
                count + " processors registered, fallback '" + processorRegistry.fallback().id() + "'",
                Map.of("count", String.valueOf(count)));
    }
}
