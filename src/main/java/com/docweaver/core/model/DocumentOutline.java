package com.docweaver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Merged output of the structure stage.
 */
public record DocumentOutline(
    String title,
    List<OutlineSection> sections
) implements Serializable {

    public DocumentOutline {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
