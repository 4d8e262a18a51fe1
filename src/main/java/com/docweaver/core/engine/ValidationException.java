package com.docweaver.core.engine;

import java.util.List;

/**
 * A generation request was rejected before any task was created.
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Invalid generation request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
