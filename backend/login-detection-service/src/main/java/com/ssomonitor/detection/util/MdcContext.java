package com.ssomonitor.detection.util;

import org.slf4j.MDC;

/**
 * MDC keys attached to every log line written while a task is handled.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String analysis) {
        if (taskId != null) {
            MDC.put("taskId", taskId);
        }
        if (analysis != null) {
            MDC.put("analysis", analysis);
        }
    }

    public static void setStrategy(String strategy) {
        MDC.put("strategy", strategy);
    }

    public static void clearStrategy() {
        MDC.remove("strategy");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("analysis");
        MDC.remove("strategy");
    }
}
