package com.docweaver.core.model;

import java.io.Serializable;

/**
 * Written body of one outline section.
 */
public record ContentBlock(
    int sectionIndex,
    String title,
    String body
) implements Serializable {
}
