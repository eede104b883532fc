package com.quartermaster.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing the orchestrator's MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setTask(String taskId, String epicId, String prdId) {
        MDC.put("taskId", taskId);
        putIfPresent("epicId", epicId);
        putIfPresent("prdId", prdId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("epicId");
        MDC.remove("prdId");
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
