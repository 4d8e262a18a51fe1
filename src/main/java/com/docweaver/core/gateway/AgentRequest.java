package com.docweaver.core.gateway;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform request envelope for a single agent invocation.
 *
 * @param role   the role being invoked
 * @param taskId owning task
 * @param unitId unit of work within the stage, e.g. {@code image-1}
 * @param input  role-specific payload
 */
public record AgentRequest(
    AgentRole role,
    String taskId,
    String unitId,
    Map<String, Object> input
) {

    public AgentRequest {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
