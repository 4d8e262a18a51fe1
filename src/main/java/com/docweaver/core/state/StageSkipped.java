package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;

import java.time.Instant;

/**
 * A PENDING stage that will never run, e.g. because a dependency failed or was skipped.
 */
public record StageSkipped(String stageName, String reason) implements TaskTransition {

    @Override
    public PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now) {
        var state = task.stage(stageName);
        if (state.status() != StageStatus.PENDING) {
            return task;
        }
        return task.withStage(stageName, state.skipped(now, reason));
    }

    @Override
    public String describe() {
        return "StageSkipped(" + stageName + ")";
    }
}
