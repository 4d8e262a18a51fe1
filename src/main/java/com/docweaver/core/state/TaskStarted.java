package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;
import com.docweaver.core.model.TaskStatus;

import java.time.Instant;

/**
 * PENDING &rarr; RUNNING. Stages disabled by the task's config are skipped in the same step.
 */
public record TaskStarted() implements TaskTransition {

    @Override
    public PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now) {
        if (task.status() != TaskStatus.PENDING) {
            return task;
        }
        PipelineTask updated = task.withStatus(TaskStatus.RUNNING);
        for (var stage : graph.stages()) {
            var state = updated.stage(stage.name());
            if (state.status() == StageStatus.PENDING && !stage.isEnabledFor(task.config())) {
                updated = updated.withStage(stage.name(), state.skipped(now, "disabled by configuration"));
            }
        }
        return updated;
    }
}
