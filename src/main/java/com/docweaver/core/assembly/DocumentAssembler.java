package com.docweaver.core.assembly;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a fully merged draft into a persisted document.
 * The returned handle is opaque to the pipeline and recorded on the completed task.
 */
public interface DocumentAssembler {

    CompletableFuture<String> assemble(AssemblyInput input);
}
