package com.docweaver.core.graph;

import com.docweaver.core.gateway.AgentResponse;

/**
 * A unit that completed, paired with the response it produced.
 */
public record UnitSuccess(
    PlannedUnit unit,
    AgentResponse response
) {
}
