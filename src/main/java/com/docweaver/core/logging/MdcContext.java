package com.docweaver.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Docweaver-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStage(String taskId, String stage) {
        MDC.put("taskId", taskId);
        MDC.put("stage", stage);
    }

    public static void setUnit(String taskId, String stage, String unitId) {
        MDC.put("taskId", taskId);
        MDC.put("stage", stage);
        MDC.put("unitId", unitId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("stage");
        MDC.remove("unitId");
    }
}
