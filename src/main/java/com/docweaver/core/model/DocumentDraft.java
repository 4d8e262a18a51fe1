package com.docweaver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Partial results accumulated on a task as its stages complete.
 * Every field starts empty and is filled by exactly one stage's contribution.
 */
public record DocumentDraft(
    ResearchFindings findings,
    DocumentOutline outline,
    List<ContentBlock> contentBlocks,
    List<ImageRef> images
) implements Serializable {

    public DocumentDraft {
        contentBlocks = contentBlocks == null ? List.of() : List.copyOf(contentBlocks);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static DocumentDraft empty() {
        return new DocumentDraft(null, null, List.of(), List.of());
    }

    public DocumentDraft withFindings(ResearchFindings value) {
        return new DocumentDraft(value, outline, contentBlocks, images);
    }

    public DocumentDraft withOutline(DocumentOutline value) {
        return new DocumentDraft(findings, value, contentBlocks, images);
    }

    public DocumentDraft withContentBlocks(List<ContentBlock> value) {
        return new DocumentDraft(findings, outline, value, images);
    }

    public DocumentDraft withImages(List<ImageRef> value) {
        return new DocumentDraft(findings, outline, contentBlocks, value);
    }
}
