package com.aejis.sandbox;

import java.time.Duration;

/**
 * Thrown when a container operation outlives its wall-clock budget.
 */
public class ContainerTimeoutException extends SandboxException {

    private final Duration budget;

    public ContainerTimeoutException(String message, Duration budget) {
        super(message);
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }
}
