package com.docweaver.core.graph;

import com.docweaver.core.model.PipelineTask;

import java.util.List;

/**
 * Derives a stage's units of work from the task snapshot taken at dispatch time.
 * The snapshot already carries the contributions of every upstream stage.
 */
@FunctionalInterface
public interface UnitPlanner {

    List<PlannedUnit> plan(PipelineTask task);
}
