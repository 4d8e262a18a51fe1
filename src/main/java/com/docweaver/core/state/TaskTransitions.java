package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.DocumentDraft;
import com.docweaver.core.model.ErrorKind;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageState;
import com.docweaver.core.model.StageStatus;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.TaskStatus;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.UUID;

/**
 * Bookkeeping shared by every {@link TaskStateStore} implementation.
 */
public final class TaskTransitions {

    private TaskTransitions() {
    }

    /** Opaque task id, e.g. {@code DOC-2026-3fa9c01b}. */
    public static String nextTaskId(Instant now) {
        int year = now.atZone(ZoneOffset.UTC).getYear();
        return "DOC-" + year + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static PipelineTask newTask(String id, GenerationRequest request, PipelineGraph graph, Instant now) {
        var stages = new LinkedHashMap<String, StageState>();
        for (var stage : graph.stages()) {
            stages.put(stage.name(), StageState.pending(stage.required()));
        }
        return new PipelineTask(id, request.topic(), request.config(), TaskStatus.PENDING, 0.0,
                stages, DocumentDraft.empty(), null, null, now, now);
    }

    /**
     * Applies {@code transition} to {@code current} and derives the fields a transition never
     * sets itself: progress, failure on a required stage, and {@code updatedAt}.
     * Returns {@code current} unchanged when it is already terminal.
     */
    public static PipelineTask apply(PipelineTask current, TaskTransition transition, PipelineGraph graph,
                                     Instant now) {
        if (current.isTerminal()) {
            return current;
        }
        PipelineTask next = transition.applyTo(current, graph, now);
        if (next == current) {
            return current;
        }

        if (next.status() == TaskStatus.RUNNING) {
            for (var entry : next.stages().entrySet()) {
                StageState state = entry.getValue();
                if (state.required() && state.status() == StageStatus.FAILED) {
                    next = next.failed(state.error() != null ? state.error().withStage(entry.getKey())
                            : new TaskError(entry.getKey(), ErrorKind.FATAL, "stage failed", null));
                    break;
                }
            }
        }

        if (next.status() != TaskStatus.COMPLETED) {
            double derived = graph.settledFraction(next.stageStatuses());
            next = next.withProgress(Math.max(current.progress(), derived));
        }
        return next.touchedAt(now);
    }
}
