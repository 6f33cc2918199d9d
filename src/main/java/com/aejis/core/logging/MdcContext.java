package com.aejis.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing job-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId, String processor) {
        MDC.put("jobId", jobId);
        MDC.put("processor", processor);
    }

    public static void setContainer(String containerId) {
        MDC.put("containerId", containerId);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("processor");
        MDC.remove("containerId");
    }
}
