package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;

import java.io.IOException;

/**
 * One per-type processing routine. Runs only inside the sandbox container, reads the
 * artifact handed to it and returns a {@link ProcessingResult}; the entrypoint writes
 * that result as the single JSON object on stdout.
 *
 * <p>New file types are supported by registering a new processor in
 * {@link ProcessorRegistry}, never by branching inside an existing one.
 */
public interface Processor {

    /** Stable id, also passed to the container entrypoint. */
    String id();

    MatchCriteria criteria();

    ProcessingResult process(Artifact artifact, ProcessingContext context) throws IOException;

    /**
     * Whether jobs for this processor must run in a fresh ephemeral container rather
     * than the shared warm one.
     */
    default boolean isolationSensitive() {
        return false;
    }
}
