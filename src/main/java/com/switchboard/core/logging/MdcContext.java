package com.switchboard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Switchboard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void setTask(String planId, int taskIndex, String worker) {
        MDC.put("planId", planId);
        MDC.put("taskIndex", String.valueOf(taskIndex));
        if (worker != null) {
            MDC.put("worker", worker);
        }
    }

    public static void setToolHandler(String handlerName) {
        MDC.put("toolHandler", handlerName);
    }

    public static void clearToolHandler() {
        MDC.remove("toolHandler");
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("taskIndex");
        MDC.remove("worker");
        MDC.remove("toolHandler");
    }
}
