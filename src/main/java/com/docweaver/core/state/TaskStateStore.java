package com.docweaver.core.state;

import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.PipelineTask;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative record of every task.
 *
 * <p>{@link #apply} is the only way a task changes. It is atomic per task id: concurrent
 * callers for the same id are serialized, callers for different ids are not. Every returned
 * {@link PipelineTask} is an immutable, fully consistent snapshot.
 */
public interface TaskStateStore {

    /** Creates a PENDING task with every stage PENDING and returns its first snapshot. */
    PipelineTask create(GenerationRequest request);

    Optional<PipelineTask> get(String taskId);

    /** All tasks, newest first. */
    List<PipelineTask> list();

    /**
     * Tasks not yet COMPLETED or FAILED that were created through this store's owner, oldest
     * first. Tasks created by other service instances sharing the same storage are excluded.
     */
    List<PipelineTask> listOwnedUnfinished();

    /**
     * Applies {@code transition} and returns the resulting snapshot. A transition against a
     * task that is already COMPLETED or FAILED is ignored and the unchanged snapshot returned.
     *
     * @throws TaskNotFoundException if the id is unknown
     */
    PipelineTask apply(String taskId, TaskTransition transition);
}
