package com.docweaver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Merged output of the research stage.
 */
public record ResearchFindings(
    List<ResearchNote> notes
) implements Serializable {

    public ResearchFindings {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
