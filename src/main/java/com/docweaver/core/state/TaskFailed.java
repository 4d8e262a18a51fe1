package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.TaskError;

import java.time.Instant;

/**
 * Fails the task outright: cancellation, assembly failure, or an orchestration error.
 */
public record TaskFailed(TaskError error) implements TaskTransition {

    @Override
    public PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now) {
        return task.failed(error);
    }

    @Override
    public String describe() {
        return "TaskFailed(" + error.kind() + ")";
    }
}
