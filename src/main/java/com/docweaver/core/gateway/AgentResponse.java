package com.docweaver.core.gateway;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform response envelope returned by every backend.
 *
 * @param role   the role that answered
 * @param unitId unit of work the response belongs to
 * @param output role-specific payload
 */
public record AgentResponse(
    AgentRole role,
    String unitId,
    Map<String, Object> output
) {

    public AgentResponse {
        output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }
}
