package com.docweaver.core.gateway;

import com.docweaver.core.model.ErrorKind;

/**
 * Retryable collaborator failure: timeout, rate limit, or network trouble.
 */
public class TransientAgentException extends AgentException {

    public static final String TIMEOUT = "timeout";
    public static final String RATE_LIMITED = "rate_limited";
    public static final String UNAVAILABLE = "unavailable";
    public static final String NETWORK = "network";

    public TransientAgentException(String reason, String message) {
        super(reason, message, null);
    }

    public TransientAgentException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}
