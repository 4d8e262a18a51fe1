package com.docweaver.core.assembly;

import com.docweaver.core.model.ContentBlock;
import com.docweaver.core.model.ImageRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes the document as {@code <taskId>.md} in the output directory and returns the
 * file's absolute path as the artifact handle.
 *
 * <p>Sections follow outline order. A section's image, if any, is placed after its text.
 * Sections without a content block are omitted.
 */
public class MarkdownDocumentAssembler implements DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(MarkdownDocumentAssembler.class);

    private final Path outputDirectory;
    private final Executor executor;

    public MarkdownDocumentAssembler(Path outputDirectory, Executor executor) {
        this.outputDirectory = outputDirectory;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> assemble(AssemblyInput input) {
        return CompletableFuture.supplyAsync(() -> write(input), executor);
    }

    String render(AssemblyInput input) {
        var outline = input.outline();
        String title = outline != null && outline.title() != null ? outline.title() : input.topic();

        var blocks = input.contentBlocks().stream()
                .collect(Collectors.toMap(ContentBlock::sectionIndex, Function.identity(), (a, b) -> a));
        var images = input.images().stream()
                .collect(Collectors.toMap(ImageRef::sectionIndex, Function.identity(), (a, b) -> a));

        List<ContentBlock> ordered = outline != null
                ? outline.sections().stream()
                        .map(section -> blocks.get(section.index()))
                        .filter(Objects::nonNull)
                        .toList()
                : input.contentBlocks().stream()
                        .sorted(Comparator.comparingInt(ContentBlock::sectionIndex))
                        .toList();

        var sb = new StringBuilder();
        sb.append("# ").append(title).append("\n\n");
        for (var block : ordered) {
            sb.append("## ").append(block.title()).append("\n\n");
            sb.append(block.body().strip()).append("\n\n");
            var image = images.get(block.sectionIndex());
            if (image != null) {
                String caption = image.caption() != null ? image.caption() : block.title();
                sb.append("![").append(caption).append("](").append(image.uri()).append(")\n\n");
            }
        }
        return sb.toString();
    }

    private String write(AssemblyInput input) {
        String markdown = render(input);
        try {
            Files.createDirectories(outputDirectory);
            Path target = outputDirectory.resolve(input.taskId() + ".md").toAbsolutePath();
            Files.writeString(target, markdown, StandardCharsets.UTF_8);
            log.info("Assembled document for task {} at {} ({} chars)", input.taskId(), target, markdown.length());
            return target.toString();
        } catch (IOException e) {
            throw new AssemblyException("Failed to write document for task " + input.taskId(), e);
        }
    }
}
