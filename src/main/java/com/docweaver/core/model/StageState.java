package com.docweaver.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Per-task runtime state of one stage.
 *
 * @param status      current status
 * @param required    whether failure of this stage fails the task
 * @param startedAt   when the stage was dispatched
 * @param finishedAt  when the stage settled
 * @param error       first terminal error when FAILED
 * @param skipReason  why the stage never ran, when SKIPPED
 * @param failedUnits units that failed terminally (optional stages complete without them)
 * @param units       attempt telemetry of every unit the stage ran
 */
public record StageState(
    StageStatus status,
    boolean required,
    Instant startedAt,
    Instant finishedAt,
    TaskError error,
    String skipReason,
    List<String> failedUnits,
    List<UnitTelemetry> units
) implements Serializable {

    public StageState {
        failedUnits = failedUnits == null ? List.of() : List.copyOf(failedUnits);
        units = units == null ? List.of() : List.copyOf(units);
    }

    public static StageState pending(boolean required) {
        return new StageState(StageStatus.PENDING, required, null, null, null, null, List.of(), List.of());
    }

    public StageState started(Instant now) {
        return new StageState(StageStatus.RUNNING, required, now, null, null, null, List.of(), List.of());
    }

    public StageState skipped(Instant now, String reason) {
        return new StageState(StageStatus.SKIPPED, required, startedAt, now, null, reason, List.of(), List.of());
    }

    public StageState finished(StageStatus outcome, Instant now, TaskError stageError,
                               List<String> failed, List<UnitTelemetry> telemetry) {
        return new StageState(outcome, required, startedAt, now, stageError, null, failed, telemetry);
    }
}
