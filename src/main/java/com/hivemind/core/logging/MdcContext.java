package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setAssignment(String taskId, String agentId, String capability) {
        MDC.put("taskId", taskId);
        MDC.put("agentId", agentId);
        MDC.put("capability", capability);
    }

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("capability");
    }
}
