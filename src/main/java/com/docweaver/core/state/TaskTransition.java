package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;

import java.time.Instant;

/**
 * A single mutation of a task, applied atomically by {@link TaskStateStore#apply}.
 *
 * <p>Implementations only describe the change. The store takes care of ignoring
 * transitions on terminal tasks, recomputing progress, evaluating terminality
 * and stamping {@code updatedAt}.
 */
@FunctionalInterface
public interface TaskTransition {

    PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now);

    /** Short label used in logs. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
