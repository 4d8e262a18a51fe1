package com.docweaver.dispatch.cli;

import com.docweaver.core.engine.GenerationRequestValidator;
import com.docweaver.core.engine.PipelineOrchestrator;
import com.docweaver.core.engine.ValidationException;
import com.docweaver.core.events.EventBus;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: docweaver generate "&lt;topic&gt;"
 * <p>
 * Runs one document task in-process, printing stage events as they happen, and exits
 * with 0 when the document was assembled and 1 otherwise.
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Generate a document about a topic")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Document topic")
    private String topic;

    @Option(names = {"--template", "-t"}, description = "Template: standard, academic, business")
    private String template;

    @Option(names = {"--max-sections"}, description = "Upper bound on outline sections")
    private Integer maxSections;

    @Option(names = {"--concurrency", "-c"}, description = "Units of this task in flight at once")
    private Integer concurrency;

    @Option(names = {"--images"}, negatable = true, description = "Generate section images (default: on)")
    private Boolean includeImages;

    @Option(names = {"--image-style"}, description = "abstract, realistic, diagram, infographic, artistic")
    private String imageStyle;

    private final PipelineOrchestrator orchestrator;
    private final GenerationRequestValidator validator;
    private final EventBus eventBus;

    public GenerateCommand(PipelineOrchestrator orchestrator, GenerationRequestValidator validator,
                           EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.validator = validator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String taskId;
        try {
            var request = validator.build(topic, template, maxSections, concurrency, includeImages, imageStyle);
            // A CLI process runs a single task, so every event belongs to it. Subscribing
            // before submit keeps task.created in the output.
            var subscription = eventBus.subscribeAll(ConsoleOutput::event);
            try {
                taskId = orchestrator.submit(request);
                ConsoleOutput.info("Task " + taskId + " submitted");
                return await(taskId);
            } finally {
                subscription.unsubscribe();
            }
        } catch (ValidationException e) {
            for (String violation : e.violations()) {
                ConsoleOutput.error(violation);
            }
            return 1;
        }
    }

    private int await(String taskId) {
        long startMs = System.currentTimeMillis();
        PipelineTask task;
        try {
            task = orchestrator.whenTerminal(taskId).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestrator.cancel(taskId);
            ConsoleOutput.error("Interrupted; task " + taskId + " cancelled");
            return 1;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Task " + taskId + " failed: " + e.getCause().getMessage());
            return 1;
        }

        ConsoleOutput.taskSummary(task);
        System.out.println();
        String elapsed = ConsoleOutput.formatDuration(System.currentTimeMillis() - startMs);
        if (task.status() == TaskStatus.COMPLETED) {
            ConsoleOutput.success("Document written to " + task.artifactHandle() + " in " + elapsed);
            return 0;
        }
        ConsoleOutput.error("Task " + task.status() + ": "
                + (task.error() != null ? task.error().summary() : "no error recorded"));
        return 1;
    }
}
