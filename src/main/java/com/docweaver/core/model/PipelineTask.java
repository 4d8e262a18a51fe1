package com.docweaver.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, point-in-time snapshot of a document generation task.
 * Produced and replaced only by the task state store.
 *
 * @param id             opaque task identifier
 * @param topic          requested topic
 * @param config         generation settings
 * @param status         lifecycle status
 * @param progress       derived progress fraction in [0, 1]
 * @param stages         per-stage state in pipeline declaration order
 * @param draft          accumulated stage outputs
 * @param error          present iff status is FAILED
 * @param artifactHandle present iff status is COMPLETED
 * @param createdAt      creation time
 * @param updatedAt      time of the last applied transition
 */
public record PipelineTask(
    String id,
    String topic,
    GenerationConfig config,
    TaskStatus status,
    double progress,
    Map<String, StageState> stages,
    DocumentDraft draft,
    TaskError error,
    String artifactHandle,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public PipelineTask {
        stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public StageState stage(String name) {
        StageState state = stages.get(name);
        if (state == null) {
            throw new IllegalArgumentException("Unknown stage '" + name + "' on task " + id);
        }
        return state;
    }

    /** Stage name to status, in declaration order. */
    public Map<String, StageStatus> stageStatuses() {
        var statuses = new LinkedHashMap<String, StageStatus>();
        stages.forEach((name, state) -> statuses.put(name, state.status()));
        return statuses;
    }

    public PipelineTask withStatus(TaskStatus value) {
        return new PipelineTask(id, topic, config, value, progress, stages, draft, error, artifactHandle,
                createdAt, updatedAt);
    }

    public PipelineTask withProgress(double value) {
        return new PipelineTask(id, topic, config, status, value, stages, draft, error, artifactHandle,
                createdAt, updatedAt);
    }

    public PipelineTask withStage(String name, StageState state) {
        if (!stages.containsKey(name)) {
            throw new IllegalArgumentException("Unknown stage '" + name + "' on task " + id);
        }
        var updated = new LinkedHashMap<>(stages);
        updated.put(name, state);
        return new PipelineTask(id, topic, config, status, progress, updated, draft, error, artifactHandle,
                createdAt, updatedAt);
    }

    public PipelineTask withDraft(DocumentDraft value) {
        return new PipelineTask(id, topic, config, status, progress, stages, value, error, artifactHandle,
                createdAt, updatedAt);
    }

    public PipelineTask failed(TaskError value) {
        return new PipelineTask(id, topic, config, TaskStatus.FAILED, progress, stages, draft, value, null,
                createdAt, updatedAt);
    }

    public PipelineTask completed(String handle) {
        return new PipelineTask(id, topic, config, TaskStatus.COMPLETED, 1.0, stages, draft, null, handle,
                createdAt, updatedAt);
    }

    public PipelineTask touchedAt(Instant now) {
        return new PipelineTask(id, topic, config, status, progress, stages, draft, error, artifactHandle,
                createdAt, now);
    }
}
