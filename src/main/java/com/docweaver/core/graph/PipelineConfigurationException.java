package com.docweaver.core.graph;

/**
 * Thrown while building a {@link PipelineGraph} that violates its structural rules.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
