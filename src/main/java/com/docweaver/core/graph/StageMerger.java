package com.docweaver.core.graph;

import com.docweaver.core.model.PipelineTask;

import java.util.List;

/**
 * Combines the successful units of a stage, in unit order, into the stage's contribution.
 * Units that failed on an optional stage are absent from {@code successes}.
 */
@FunctionalInterface
public interface StageMerger {

    DraftContribution merge(PipelineTask task, List<UnitSuccess> successes);
}
