package com.docweaver.core.gateway;

import java.util.Locale;

/**
 * Closed set of collaborator roles the pipeline can call.
 * New roles are added here and bound to a backend in the gateway's role table.
 */
public enum AgentRole {
    RESEARCH,
    STRUCTURE,
    WRITE,
    IMAGE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
