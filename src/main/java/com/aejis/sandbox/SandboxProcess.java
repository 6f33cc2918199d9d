package com.aejis.sandbox;

import java.time.Duration;

/**
 * One processor invocation running inside a container. Implementations buffer the
 * process output up to a fixed cap; anything beyond it is dropped.
 */
public interface SandboxProcess {

    String containerId();

    boolean isRunning();

    /**
     * @return exit code once the process has finished, {@code null} while it runs
     */
    Integer exitCode();

    /** Waits for the output stream to drain after the process has exited. */
    void awaitOutput(Duration timeout);

    String stdout();

    String stderr();

    /**
     * Forcibly terminates the process. There is no graceful variant: the code being
     * run is not trusted to cooperate.
     */
    void kill();
}
