package com.aejis.sandbox.monitor;

import com.aejis.core.model.JobState;

import java.time.Duration;

/**
 * Terminal outcome of one supervised process.
 *
 * @param state    {@code COMPLETED}, {@code TIMED_OUT} or {@code FAILED}
 * @param reason   why the state was reached
 * @param exitCode process exit code, null if it was killed or never reported one
 * @param stdout   captured stdout, possibly partial after a kill
 * @param stderr   captured stderr, size-capped; diagnostic only, never trusted content
 * @param killed   whether the monitor force-killed the process
 * @param elapsed  wall-clock time from start of supervision to the terminal state
 */
public record SupervisionReport(
    JobState state,
    Reason reason,
    Integer exitCode,
    String stdout,
    String stderr,
    boolean killed,
    Duration elapsed
) {

    public enum Reason {
        NONE,
        WALL_TIME_EXCEEDED,
        CANCELLED,
        NON_ZERO_EXIT,
        NO_OUTPUT,
        MONITOR_ERROR
    }

    public boolean completed() {
        return state == JobState.COMPLETED;
    }
}
