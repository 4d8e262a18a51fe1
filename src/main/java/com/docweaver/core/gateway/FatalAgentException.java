package com.docweaver.core.gateway;

import com.docweaver.core.model.ErrorKind;

/**
 * Non-retryable collaborator failure. Escalated on first occurrence.
 */
public class FatalAgentException extends AgentException {

    public static final String REJECTED = "rejected";
    public static final String MALFORMED = "malformed_response";
    public static final String UNBOUND = "unbound_role";
    public static final String FAILED = "failed";

    public FatalAgentException(String reason, String message) {
        super(reason, message, null);
    }

    public FatalAgentException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL;
    }
}
