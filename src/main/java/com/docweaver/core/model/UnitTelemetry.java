package com.docweaver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Attempt history of one unit of work, kept on the stage state after the unit finishes.
 *
 * @param unitId          unit identifier, e.g. {@code write-2}
 * @param outcome         how the unit ended
 * @param attempts        number of gateway invocations made
 * @param backoffDelaysMs delays waited before each retry, in order
 * @param error           last error, null on success
 * @param elapsedMs       wall-clock time from first attempt to completion
 */
public record UnitTelemetry(
    String unitId,
    UnitOutcome outcome,
    int attempts,
    List<Long> backoffDelaysMs,
    TaskError error,
    long elapsedMs
) implements Serializable {
}
