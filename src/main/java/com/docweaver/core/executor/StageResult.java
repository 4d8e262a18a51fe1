package com.docweaver.core.executor;

import com.docweaver.core.graph.DraftContribution;
import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.UnitTelemetry;
import com.docweaver.core.state.TaskTransition;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of running one stage for one task.
 *
 * <p>Applied to the store as a transition: the stage settles as DONE or FAILED, and on
 * success its contribution is merged into the task draft.
 *
 * @param stageName    stage that ran
 * @param outcome      DONE or FAILED
 * @param contribution merged output; {@link DraftContribution#none()} on failure
 * @param error        first terminal error, present iff FAILED
 * @param failedUnits  units that failed terminally
 * @param telemetry    one entry per unit, in unit order
 */
public record StageResult(
    String stageName,
    StageStatus outcome,
    DraftContribution contribution,
    TaskError error,
    List<String> failedUnits,
    List<UnitTelemetry> telemetry
) implements TaskTransition {

    public StageResult {
        failedUnits = failedUnits == null ? List.of() : List.copyOf(failedUnits);
        telemetry = telemetry == null ? List.of() : List.copyOf(telemetry);
        contribution = contribution == null ? DraftContribution.none() : contribution;
    }

    public static StageResult done(String stageName, DraftContribution contribution,
                                   List<String> failedUnits, List<UnitTelemetry> telemetry) {
        return new StageResult(stageName, StageStatus.DONE, contribution, null, failedUnits, telemetry);
    }

    public static StageResult failed(String stageName, TaskError error,
                                     List<String> failedUnits, List<UnitTelemetry> telemetry) {
        return new StageResult(stageName, StageStatus.FAILED, DraftContribution.none(), error,
                failedUnits, telemetry);
    }

    public boolean succeeded() {
        return outcome == StageStatus.DONE;
    }

    @Override
    public PipelineTask applyTo(PipelineTask task, PipelineGraph graph, Instant now) {
        var state = task.stage(stageName);
        if (state.status() != StageStatus.RUNNING) {
            return task;
        }
        PipelineTask updated = task.withStage(stageName,
                state.finished(outcome, now, error, failedUnits, telemetry));
        if (succeeded()) {
            updated = updated.withDraft(contribution.applyTo(updated.draft()));
        }
        return updated;
    }

    @Override
    public String describe() {
        return "StageResult(" + stageName + ", " + outcome + ")";
    }
}
