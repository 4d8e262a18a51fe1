package com.docweaver.core.model;

import java.io.Serializable;

/**
 * A section of the document outline.
 *
 * @param index       zero-based position in the outline
 * @param title       section heading
 * @param brief       what the writer should cover
 * @param imagePrompt description for an illustrating image; blank when none is wanted
 */
public record OutlineSection(
    int index,
    String title,
    String brief,
    String imagePrompt
) implements Serializable {

    public boolean wantsImage() {
        return imagePrompt != null && !imagePrompt.isBlank();
    }
}
