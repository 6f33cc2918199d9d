package com.aejis.sandbox;

/**
 * Thrown when the container runtime cannot be reached or no container can be provided.
 * Puts the pool into degraded mode; it never stops the dispatcher.
 */
public class ContainerUnavailableException extends SandboxException {

    public ContainerUnavailableException(String message) {
        super(message);
    }

    public ContainerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
