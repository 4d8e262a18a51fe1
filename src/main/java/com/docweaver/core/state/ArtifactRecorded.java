package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;

import java.time.Instant;

/**
 * Records the assembled artifact and completes the task.
 */
public record ArtifactRecorded(String artifactHandle) implements TaskTransition {

    @Override
    public PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now) {
        if (artifactHandle == null || artifactHandle.isBlank()) {
            throw new IllegalArgumentException("Artifact handle must not be blank");
        }
        var statuses = task.stageStatuses();
        if (!graph.isSettled(statuses)) {
            throw new IllegalStateException("Task " + task.id() + " still has unsettled stages: " + statuses);
        }
        for (var stage : graph.stages()) {
            if (stage.required() && statuses.get(stage.name()) != StageStatus.DONE) {
                throw new IllegalStateException("Task " + task.id() + " cannot complete, required stage "
                        + stage.name() + " is " + statuses.get(stage.name()));
            }
        }
        return task.completed(artifactHandle);
    }

    @Override
    public String describe() {
        return "ArtifactRecorded";
    }
}
