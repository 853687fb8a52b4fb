package com.vulnconsole.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing console-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEnvironment(String environmentId) {
        MDC.put("envId", environmentId);
    }

    public static void setOperation(String environmentId, String operation) {
        MDC.put("envId", environmentId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("envId");
        MDC.remove("operation");
    }
}
