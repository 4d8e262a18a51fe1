package com.docweaver.core.model;

import java.io.Serializable;

/**
 * Error recorded on a failed task or stage.
 *
 * @param stage   name of the failing stage; null for task-level errors such as cancellation
 * @param kind    error class
 * @param message human-readable detail
 * @param unitId  the unit of work that failed, if the error came from one
 */
public record TaskError(
    String stage,
    ErrorKind kind,
    String message,
    String unitId
) implements Serializable {

    public static TaskError cancelled(String reason) {
        return new TaskError(null, ErrorKind.CANCELLED, reason, null);
    }

    public TaskError withStage(String stageName) {
        return new TaskError(stageName, kind, message, unitId);
    }

    /** One-line summary, e.g. {@code write: TRANSIENT (rate limited)}. */
    public String summary() {
        String prefix = stage != null ? stage + ": " : "";
        return prefix + kind + (message != null ? " (" + message + ")" : "");
    }
}
