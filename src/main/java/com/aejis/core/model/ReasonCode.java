package com.aejis.core.model;

/**
 * Explicit reason attached to every job outcome. {@link #NONE} only accompanies a
 * completed job whose processor reported success.
 */
public enum ReasonCode {
    NONE,
    /** Container runtime unreachable; no verdict is available. */
    DOCKER_REQUIRED,
    /** Wall-clock budget exhausted; the container was force-killed. */
    WALL_TIME_EXCEEDED,
    /** Caller stopped the job; the container was force-killed. */
    CANCELLED,
    /** Processor exited non-zero or the exec could not be driven. */
    EXECUTION_FAILURE,
    /** Processor exited cleanly but wrote nothing. */
    NO_OUTPUT,
    /** No JSON object could be recovered from the container output. */
    RESULT_PARSE_FAILURE,
    /** Archive expansion crossed a configured threshold and was aborted. */
    ARCHIVE_LIMIT_EXCEEDED,
    /** Processor ran and reported {@code success=false}. */
    PROCESSOR_FAILURE,
    /** Artifact could not be copied into the job scratch space. */
    STAGING_FAILURE
}
