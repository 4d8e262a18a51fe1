package com.docweaver.core.engine;

import com.docweaver.core.executor.ConcurrencyBudget;
import com.docweaver.core.executor.StageExecution;
import com.docweaver.core.model.PipelineTask;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process bookkeeping for one task while the orchestrator drives it. Mutable fields are
 * guarded by the instance monitor.
 */
final class TaskRun {

    private final String taskId;
    private final String template;
    private final ConcurrencyBudget taskBudget;
    private final long startedMs = System.currentTimeMillis();
    private final Map<String, StageExecution> inFlight = new LinkedHashMap<>();
    private final CompletableFuture<PipelineTask> terminal = new CompletableFuture<>();
    private final AtomicBoolean terminalPublished = new AtomicBoolean();

    private boolean cancelled;
    private boolean assembling;

    TaskRun(String taskId, String template, ConcurrencyBudget taskBudget) {
        this.taskId = taskId;
        this.template = template;
        this.taskBudget = taskBudget;
    }

    String taskId() {
        return taskId;
    }

    String template() {
        return template;
    }

    ConcurrencyBudget taskBudget() {
        return taskBudget;
    }

    long startedMs() {
        return startedMs;
    }

    Map<String, StageExecution> inFlight() {
        return inFlight;
    }

    CompletableFuture<PipelineTask> terminal() {
        return terminal;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void markCancelled() {
        cancelled = true;
    }

    boolean isAssembling() {
        return assembling;
    }

    void markAssembling() {
        assembling = true;
    }

    /** True for the first caller only. */
    boolean claimTerminal() {
        return terminalPublished.compareAndSet(false, true);
    }
}
