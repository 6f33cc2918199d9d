package com.aejis.sandbox;

/**
 * Operating mode of the {@link ContainerPoolManager}.
 */
public enum PoolMode {
    /** Regular jobs run serially on the warm container. */
    WARM,
    /** Warm container could not be (re)created; every job gets an ephemeral container. */
    EPHEMERAL_ONLY,
    /** Container runtime unreachable; no job can run and no verdict is produced. */
    DOCKER_REQUIRED
}
