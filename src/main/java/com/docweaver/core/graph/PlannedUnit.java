package com.docweaver.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of fan-out work a stage intends to run.
 *
 * @param unitId stable id within the task, e.g. {@code write-2}
 * @param index  position of the unit in the stage's fan-out; merges preserve this order
 * @param input  role-specific request payload
 */
public record PlannedUnit(
    String unitId,
    int index,
    Map<String, Object> input
) {

    public PlannedUnit {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
