package com.docweaver.core.gateway;

import com.docweaver.core.model.ErrorKind;

/**
 * Base of the two failure classes the gateway surfaces.
 */
public abstract class AgentException extends RuntimeException {

    private final String reason;

    protected AgentException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Short machine-readable reason, e.g. {@code rate_limited}. */
    public String reason() {
        return reason;
    }

    public abstract ErrorKind kind();
}
