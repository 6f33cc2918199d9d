package com.aejis.core.model;

/**
 * Lifecycle of a supervised job: {@code PENDING -> RUNNING -> {COMPLETED | TIMED_OUT | FAILED}}.
 */
public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
