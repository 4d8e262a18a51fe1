package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;

import java.time.Instant;

/**
 * PENDING &rarr; RUNNING for one stage.
 */
public record StageStarted(String stageName) implements TaskTransition {

    @Override
    public PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now) {
        var state = task.stage(stageName);
        if (state.status() != StageStatus.PENDING) {
            return task;
        }
        return task.withStage(stageName, state.started(now));
    }

    @Override
    public String describe() {
        return "StageStarted(" + stageName + ")";
    }
}
