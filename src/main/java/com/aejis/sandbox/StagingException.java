package com.aejis.sandbox;

/**
 * Thrown when an artifact cannot be copied into, or wiped from, a job's scratch space.
 */
public class StagingException extends SandboxException {

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
