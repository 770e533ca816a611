package com.branchwork.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Branchwork-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEpic(String epicId) {
        MDC.put("epicId", epicId);
    }

    public static void setSubTask(String epicId, String subTaskId, String agentId) {
        MDC.put("epicId", epicId);
        MDC.put("subTaskId", subTaskId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        }
    }

    public static void clear() {
        MDC.remove("epicId");
        MDC.remove("subTaskId");
        MDC.remove("agentId");
    }
}
