package com.aejis.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during job execution, used for CLI watch mode and logging.
 *
 * @param eventType   e.g. "job.submitted", "container.acquired", "job.timed_out", "pool.degraded"
 * @param jobId       the job this event belongs to (nullable for pool-level events)
 * @param containerId the container involved (nullable)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record AejisEvent(
    String eventType,
    String jobId,
    String containerId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AejisEvent of(String eventType, String jobId, String containerId, Map<String, Object> payload) {
        return new AejisEvent(eventType, jobId, containerId, payload != null ? payload : Map.of(), Instant.now());
    }
}
