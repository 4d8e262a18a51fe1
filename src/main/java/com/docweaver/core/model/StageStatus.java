package com.docweaver.core.model;

/**
 * Status of one pipeline stage within a task.
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;  // disabled by config, or blocked by a failed/skipped dependency

    /** True once the stage will never change again. */
    public boolean isSettled() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }
}
