package com.docweaver.core.model;

/**
 * Error classes surfaced on failed tasks, stages and units.
 */
public enum ErrorKind {
    /** Bad request shape; rejected before a task exists. */
    VALIDATION,
    /** Timeout, rate limit or network trouble; retried with backoff. */
    TRANSIENT,
    /** Collaborator reported a non-retryable failure. */
    FATAL,
    /** Task cancelled while in flight. */
    CANCELLED
}
