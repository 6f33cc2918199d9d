package com.aejis.sandbox;

/**
 * Base of all failures raised while running an artifact inside the sandbox.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
