package com.aejis.sandbox;

/**
 * Thrown when the processor command cannot be started inside a container or the exec
 * cannot be driven to completion.
 */
public class ContainerExecutionException extends SandboxException {

    public ContainerExecutionException(String message) {
        super(message);
    }

    public ContainerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
