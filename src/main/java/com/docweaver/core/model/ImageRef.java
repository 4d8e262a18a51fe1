package com.docweaver.core.model;

import java.io.Serializable;

/**
 * Reference to a generated image for one outline section.
 */
public record ImageRef(
    int sectionIndex,
    String uri,
    String caption
) implements Serializable {
}
