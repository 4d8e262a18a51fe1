package com.docweaver.core.model;

/**
 * Terminal outcome of a single unit of work.
 */
public enum UnitOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
