package com.docweaver.dispatch.cli;

import com.docweaver.core.engine.PipelineOrchestrator;
import com.docweaver.core.model.TaskStatus;
import com.docweaver.core.state.TaskNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: docweaver status &lt;task-id&gt;
 * <p>
 * Reads a task snapshot from the task store. Only useful with the JDBC store, since the
 * in-memory store does not outlive the process that ran the task.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the state of a task")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final PipelineOrchestrator orchestrator;

    public StatusCommand(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var task = orchestrator.status(taskId);
            ConsoleOutput.taskSummary(task);
            System.out.println();
            if (task.status() == TaskStatus.COMPLETED) {
                ConsoleOutput.success("Status: COMPLETED, artifact " + task.artifactHandle());
            } else if (task.status() == TaskStatus.FAILED) {
                ConsoleOutput.error("Status: FAILED, " + (task.error() != null ? task.error().summary() : "-"));
            } else {
                ConsoleOutput.info("Status: " + task.status());
            }
            return 0;
        } catch (TaskNotFoundException e) {
            ConsoleOutput.error("Task not found: " + taskId);
            return 1;
        }
    }
}
