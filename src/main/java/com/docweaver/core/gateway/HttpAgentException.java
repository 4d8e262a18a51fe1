package com.docweaver.core.gateway;

/**
 * Raised by {@link HttpAgentBackend} when a collaborator answers with a non-2xx status.
 */
public class HttpAgentException extends RuntimeException {

    private final int statusCode;

    public HttpAgentException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
