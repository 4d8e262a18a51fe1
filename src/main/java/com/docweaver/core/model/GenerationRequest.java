package com.docweaver.core.model;

import java.io.Serializable;

/**
 * A validated request to generate a document about {@code topic}.
 */
public record GenerationRequest(
    String topic,
    GenerationConfig config
) implements Serializable {
}
