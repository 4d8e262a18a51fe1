package com.docweaver.core.assembly;

import com.docweaver.core.model.ContentBlock;
import com.docweaver.core.model.DocumentOutline;
import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.ImageRef;

import java.util.List;

/**
 * Everything the assembler needs to produce the final document.
 */
public record AssemblyInput(
    String taskId,
    String topic,
    GenerationConfig config,
    DocumentOutline outline,
    List<ContentBlock> contentBlocks,
    List<ImageRef> images
) {

    public AssemblyInput {
        contentBlocks = contentBlocks == null ? List.of() : List.copyOf(contentBlocks);
        images = images == null ? List.of() : List.copyOf(images);
    }
}
