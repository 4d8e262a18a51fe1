package com.docweaver.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during task execution, used for SSE streaming and the CLI progress view.
 *
 * @param eventType event type (e.g. "task.created", "stage.started", "task.completed")
 * @param taskId    the task this event belongs to
 * @param stageName the stage this event relates to (nullable for task-level events)
 * @param status    task status for task-level events, stage status for stage events
 * @param progress  task progress after the change, in [0, 1]
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String taskId,
    String stageName,
    String status,
    double progress,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_CREATED = "task.created";
    public static final String TASK_STARTED = "task.started";
    public static final String STAGE_STARTED = "stage.started";
    public static final String STAGE_COMPLETED = "stage.completed";
    public static final String STAGE_FAILED = "stage.failed";
    public static final String STAGE_SKIPPED = "stage.skipped";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";

    public boolean isTerminal() {
        return TASK_COMPLETED.equals(eventType) || TASK_FAILED.equals(eventType);
    }
}
