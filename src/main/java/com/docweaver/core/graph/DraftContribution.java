package com.docweaver.core.graph;

import com.docweaver.core.model.DocumentDraft;

/**
 * A stage's merged output, applied to the task draft by the state store.
 */
@FunctionalInterface
public interface DraftContribution {

    DocumentDraft applyTo(DocumentDraft draft);

    static DraftContribution none() {
        return draft -> draft;
    }
}
