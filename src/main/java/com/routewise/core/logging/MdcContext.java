package com.routewise.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Routewise-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final String ROUTING_ID = "routingId";
    static final String TASK_ID = "taskId";
    static final String HANDLER_ID = "handlerId";

    private MdcContext() {}

    public static void setRouting(String routingId, String taskId) {
        MDC.put(ROUTING_ID, routingId);
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
    }

    public static void setHandler(String handlerId) {
        MDC.put(HANDLER_ID, handlerId);
    }

    public static void clear() {
        MDC.remove(ROUTING_ID);
        MDC.remove(TASK_ID);
        MDC.remove(HANDLER_ID);
    }
}
