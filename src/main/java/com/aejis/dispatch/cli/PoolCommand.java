package com.aejis.dispatch.cli;

import com.aejis.sandbox.ContainerPoolManager;
import com.aejis.sandbox.PoolSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: aejis pool [--reset]
 */
@Command(name = "pool", mixinStandardHelpOptions = true, description = "Show the container pool state")
@Component
public class PoolCommand implements Runnable {

    @Option(names = "--reset", description = "Destroy the warm container so the next job recreates it")
    private boolean reset;

    private final ContainerPoolManager poolManager;

    public PoolCommand(ContainerPoolManager poolManager) {
        this.poolManager = poolManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (reset) {
            poolManager.resetWarm();
            ConsoleOutput.success("Warm container reset");
        }

        PoolSnapshot snapshot = poolManager.snapshot();
        switch (snapshot.mode()) {
            case WARM -> ConsoleOutput.success("Mode: WARM");
            case EPHEMERAL_ONLY -> ConsoleOutput.warn("Mode: EPHEMERAL_ONLY (warm container unavailable)");
            case DOCKER_REQUIRED -> ConsoleOutput.error("Mode: DOCKER_REQUIRED (container runtime unreachable)");
        }

        if (snapshot.warmContainerId() != null) {
            ConsoleOutput.sandbox("Warm " + ConsoleOutput.shortId(snapshot.warmContainerId())
                    + " " + snapshot.warmStatus()
                    + (snapshot.warmLastUsedAt() != null ? ", last used " + snapshot.warmLastUsedAt() : ""));
        } else {
            ConsoleOutput.sandbox("No warm container");
        }
        ConsoleOutput.sandbox("Ephemeral in flight: " + snapshot.ephemeralInFlight()
                + "/" + snapshot.ephemeralCapacity());
        if (snapshot.warmRetryAt() != null) {
            ConsoleOutput.info("Warm retry after " + snapshot.warmRetryAt());
        }
    }
}
