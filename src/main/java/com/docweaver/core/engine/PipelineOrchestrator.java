package com.docweaver.core.engine;

import com.docweaver.core.assembly.AssemblyInput;
import com.docweaver.core.assembly.DocumentAssembler;
import com.docweaver.core.events.EventBus;
import com.docweaver.core.events.PipelineEvent;
import com.docweaver.core.executor.ConcurrencyBudget;
import com.docweaver.core.executor.StageExecution;
import com.docweaver.core.executor.StageExecutor;
import com.docweaver.core.executor.StageResult;
import com.docweaver.core.gateway.AgentErrorClassifier;
import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.graph.StageDefinition;
import com.docweaver.core.logging.MdcContext;
import com.docweaver.core.metrics.DocweaverMetrics;
import com.docweaver.core.model.ErrorKind;
import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.TaskStatus;
import com.docweaver.core.state.ArtifactRecorded;
import com.docweaver.core.state.StageSkipped;
import com.docweaver.core.state.StageStarted;
import com.docweaver.core.state.TaskFailed;
import com.docweaver.core.state.TaskNotFoundException;
import com.docweaver.core.state.TaskStarted;
import com.docweaver.core.state.TaskStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives document generation tasks through the {@link PipelineGraph}.
 *
 * <p>After every state change the orchestrator re-queries the graph, skips stages that can
 * no longer run, and dispatches every ready stage to the {@link StageExecutor}. Independent
 * stages run concurrently; all of them draw from the shared global budget. Once the graph
 * settles with every required stage DONE, the assembler produces the artifact and the task
 * completes. A required-stage failure fails the task and abandons in-flight optional work.
 *
 * <p>Per task, dispatch decisions are serialized on the task's {@link TaskRun}. Stage
 * completions are handled on the scheduler, never on the thread that completed the stage.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String ASSEMBLY_STAGE = "assemble";

    private final PipelineGraph graph;
    private final TaskStateStore store;
    private final StageExecutor executor;
    private final DocumentAssembler assembler;
    private final GenerationRequestValidator validator;
    private final EventBus eventBus;
    private final DocweaverMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Duration assemblyTimeout;
    private final Map<String, TaskRun> runs = new ConcurrentHashMap<>();

    public PipelineOrchestrator(PipelineGraph graph, TaskStateStore store, StageExecutor executor,
                                DocumentAssembler assembler, GenerationRequestValidator validator,
                                EventBus eventBus, DocweaverMetrics metrics,
                                ScheduledExecutorService scheduler, Duration assemblyTimeout) {
        this.graph = graph;
        this.store = store;
        this.executor = executor;
        this.assembler = assembler;
        this.validator = validator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.assemblyTimeout = assemblyTimeout;
    }

    // ── Inbound operations ──────────────────────────────────────────

    public String submit(String topic, GenerationConfig config) {
        return submit(new GenerationRequest(topic, config));
    }

    /**
     * Creates a task and starts driving it in the background.
     *
     * @return the new task id
     * @throws ValidationException if the request is invalid; no task is created
     */
    public String submit(GenerationRequest request) {
        validator.validate(request);
        PipelineTask task = store.create(request);
        String taskId = task.id();
        var run = new TaskRun(taskId, request.config().templateKind().name().toLowerCase(Locale.ROOT),
                new ConcurrencyBudget("task-" + taskId, request.config().concurrencyBudget()));
        runs.put(taskId, run);
        metrics.taskStarted();

        MdcContext.setTask(taskId);
        try {
            log.info("Submitted task {} [{}]: {}", taskId, run.template(), request.topic());
        } finally {
            MdcContext.clear();
        }
        publish(PipelineEvent.TASK_CREATED, task, null, task.status().name(),
                Map.of("topic", request.topic(), "template", run.template()));

        scheduler.execute(() -> start(run));
        return taskId;
    }

    /**
     * @throws TaskNotFoundException if the id is unknown
     */
    public PipelineTask status(String taskId) {
        return store.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public List<PipelineTask> list() {
        return store.list();
    }

    /**
     * Cancels a task. No further stages are dispatched; in-flight optional units are abandoned
     * at once. Agent calls of required stages already in flight may finish or time out, but
     * are not retried, and their results are discarded.
     *
     * @return true if this call cancelled the task, false if it had already finished
     * @throws TaskNotFoundException if the id is unknown
     */
    public boolean cancel(String taskId) {
        PipelineTask current = status(taskId);
        if (current.isTerminal()) {
            return false;
        }
        TaskRun run = runs.get(taskId);
        if (run != null) {
            synchronized (run) {
                run.markCancelled();
            }
        }
        PipelineTask task = store.apply(taskId, new TaskFailed(TaskError.cancelled("cancelled by request")));
        boolean cancelled = task.status() == TaskStatus.FAILED
                && task.error() != null && task.error().kind() == ErrorKind.CANCELLED;

        MdcContext.setTask(taskId);
        try {
            log.info("Cancel requested for task {}: {}", taskId, cancelled ? "cancelled" : "already " + task.status());
        } finally {
            MdcContext.clear();
        }
        if (run != null) {
            stopInFlightStages(run);
            onTerminal(run, task);
        }
        return cancelled;
    }

    /**
     * Completes with the task's terminal snapshot. Already-terminal tasks complete immediately.
     *
     * @throws TaskNotFoundException if the id is unknown
     */
    public CompletableFuture<PipelineTask> whenTerminal(String taskId) {
        TaskRun run = runs.get(taskId);
        if (run != null) {
            return run.terminal().copy();
        }
        PipelineTask task = status(taskId);
        if (task.isTerminal()) {
            return CompletableFuture.completedFuture(task);
        }
        return CompletableFuture.failedFuture(new IllegalStateException(
                "Task " + taskId + " is " + task.status() + " but not driven by this process"));
    }

    public PipelineGraph graph() {
        return graph;
    }

    public int activeTasks() {
        return runs.size();
    }

    /**
     * Fails tasks left unfinished by a previous run of this instance. Only meaningful with a
     * durable store; tasks owned by other instances sharing the store are left alone.
     *
     * @return number of tasks failed
     */
    public int failOrphanedTasks() {
        int failed = 0;
        for (var task : store.listOwnedUnfinished()) {
            if (!runs.containsKey(task.id())) {
                store.apply(task.id(), new TaskFailed(new TaskError(null, ErrorKind.FATAL,
                        "interrupted by service restart", null)));
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed {} task(s) orphaned by a previous run", failed);
        }
        return failed;
    }

    // ── Driving a task ──────────────────────────────────────────────

    private void start(TaskRun run) {
        MdcContext.setTask(run.taskId());
        try {
            PipelineTask task;
            synchronized (run) {
                if (run.isCancelled()) {
                    return;
                }
                task = store.apply(run.taskId(), new TaskStarted());
            }
            if (task.status() != TaskStatus.RUNNING) {
                return;
            }
            log.info("Task {} running", run.taskId());
            publish(PipelineEvent.TASK_STARTED, task, null, task.status().name(), Map.of());
            for (var entry : task.stages().entrySet()) {
                if (entry.getValue().status() == StageStatus.SKIPPED) {
                    log.info("Stage {} skipped: {}", entry.getKey(), entry.getValue().skipReason());
                    publish(PipelineEvent.STAGE_SKIPPED, task, entry.getKey(), StageStatus.SKIPPED.name(),
                            Map.of("reason", entry.getValue().skipReason()));
                }
            }
        } catch (RuntimeException e) {
            failUnexpectedly(run, e);
            return;
        } finally {
            MdcContext.clear();
        }
        advance(run);
    }

    private void advance(TaskRun run) {
        MdcContext.setTask(run.taskId());
        try {
            PipelineTask settled = null;
            synchronized (run) {
                if (run.isCancelled() || run.isAssembling()) {
                    return;
                }
                PipelineTask task = status(run.taskId());
                if (task.isTerminal()) {
                    settled = task;
                } else {
                    task = skipBlocked(task);
                    for (var stage : graph.readyStages(task)) {
                        task = dispatch(run, stage);
                    }
                    if (run.inFlight().isEmpty() && graph.isSettled(task.stageStatuses())) {
                        run.markAssembling();
                        settled = task;
                    }
                }
            }
            if (settled != null) {
                if (settled.isTerminal()) {
                    onTerminal(run, settled);
                } else {
                    assemble(run, settled);
                }
            }
        } catch (RuntimeException e) {
            failUnexpectedly(run, e);
        } finally {
            MdcContext.clear();
        }
    }

    /** Skips every pending stage blocked by a failed or skipped dependency, transitively. */
    private PipelineTask skipBlocked(PipelineTask task) {
        var blocked = graph.blockedStages(task.stageStatuses());
        while (!blocked.isEmpty()) {
            for (var stage : blocked) {
                String reason = "dependency did not complete: " + failedDependencies(task, stage);
                task = store.apply(task.id(), new StageSkipped(stage.name(), reason));
                log.info("Stage {} skipped: {}", stage.name(), reason);
                publish(PipelineEvent.STAGE_SKIPPED, task, stage.name(), StageStatus.SKIPPED.name(),
                        Map.of("reason", reason));
            }
            if (task.isTerminal()) {
                return task;
            }
            blocked = graph.blockedStages(task.stageStatuses());
        }
        return task;
    }

    private PipelineTask dispatch(TaskRun run, StageDefinition stage) {
        PipelineTask snapshot = store.apply(run.taskId(), new StageStarted(stage.name()));
        if (snapshot.isTerminal() || snapshot.stage(stage.name()).status() != StageStatus.RUNNING) {
            return snapshot;
        }
        log.info("Stage {} started [{}]", stage.name(), stage.required() ? "required" : "optional");
        publish(PipelineEvent.STAGE_STARTED, snapshot, stage.name(), StageStatus.RUNNING.name(),
                Map.of("required", stage.required()));

        var future = executor.runStage(stage, snapshot, run.taskBudget());
        run.inFlight().put(stage.name(), future);
        future.whenCompleteAsync((result, error) -> onStageComplete(run, stage, result, error), scheduler);
        return snapshot;
    }

    private void onStageComplete(TaskRun run, StageDefinition stage, StageResult result, Throwable error) {
        MdcContext.setStage(run.taskId(), stage.name());
        try {
            boolean discard;
            synchronized (run) {
                run.inFlight().remove(stage.name());
                discard = run.isCancelled();
            }
            if (error != null) {
                if (AgentErrorClassifier.unwrap(error) instanceof CancellationException) {
                    log.info("Stage {} abandoned", stage.name());
                    return;
                }
                failUnexpectedly(run, error);
                return;
            }
            if (discard) {
                log.info("Discarding {} result of stage {} for cancelled task", result.outcome(), stage.name());
                return;
            }

            PipelineTask task;
            // Applied and published under the run lock so observers see progress in order.
            synchronized (run) {
                task = store.apply(run.taskId(), result);
                if (task.stage(stage.name()).status() != result.outcome()) {
                    log.info("Discarding {} result of stage {}, task is {}", result.outcome(), stage.name(),
                            task.status());
                    return;
                }
                if (result.succeeded()) {
                    publish(PipelineEvent.STAGE_COMPLETED, task, stage.name(), result.outcome().name(),
                            Map.of("units", result.telemetry().size(), "failedUnits", result.failedUnits()));
                } else {
                    log.warn("Stage {} failed: {}", stage.name(), result.error().summary());
                    publish(PipelineEvent.STAGE_FAILED, task, stage.name(), result.outcome().name(),
                            errorPayload(result.error()));
                }
            }

            if (task.isTerminal()) {
                stopInFlightStages(run);
                onTerminal(run, task);
                return;
            }
        } catch (RuntimeException e) {
            failUnexpectedly(run, e);
            return;
        } finally {
            MdcContext.clear();
        }
        advance(run);
    }

    private void assemble(TaskRun run, PipelineTask task) {
        log.info("All stages settled for task {}, assembling", task.id());
        var draft = task.draft();
        var input = new AssemblyInput(task.id(), task.topic(), task.config(), draft.outline(),
                draft.contentBlocks(), draft.images());

        CompletableFuture<String> assembly;
        try {
            assembly = assembler.assemble(input);
        } catch (RuntimeException e) {
            assembly = CompletableFuture.failedFuture(e);
        }
        assembly.orTimeout(assemblyTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenCompleteAsync((handle, error) -> onAssembled(run, handle, error), scheduler);
    }

    private void onAssembled(TaskRun run, String handle, Throwable error) {
        MdcContext.setStage(run.taskId(), ASSEMBLY_STAGE);
        try {
            PipelineTask task;
            if (error != null) {
                Throwable cause = AgentErrorClassifier.unwrap(error);
                String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                log.error("Assembly failed for task {}: {}", run.taskId(), message, cause);
                task = store.apply(run.taskId(), new TaskFailed(
                        new TaskError(ASSEMBLY_STAGE, ErrorKind.FATAL, message, null)));
            } else {
                task = store.apply(run.taskId(), new ArtifactRecorded(handle));
            }
            onTerminal(run, task);
        } catch (RuntimeException e) {
            failUnexpectedly(run, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void onTerminal(TaskRun run, PipelineTask task) {
        if (!task.isTerminal() || !run.claimTerminal()) {
            return;
        }
        long elapsedMs = System.currentTimeMillis() - run.startedMs();
        metrics.recordTaskResult(run.template(), task.status().name().toLowerCase(Locale.ROOT), elapsedMs);
        if (task.status() == TaskStatus.COMPLETED) {
            log.info("Task {} completed in {}ms: {}", task.id(), elapsedMs, task.artifactHandle());
            publish(PipelineEvent.TASK_COMPLETED, task, null, task.status().name(),
                    Map.of("artifact", task.artifactHandle()));
        } else {
            log.error("Task {} failed after {}ms: {}", task.id(), elapsedMs,
                    task.error() != null ? task.error().summary() : "unknown error");
            publish(PipelineEvent.TASK_FAILED, task, task.error() != null ? task.error().stage() : null,
                    task.status().name(), errorPayload(task.error()));
        }
        runs.remove(run.taskId(), run);
        run.terminal().complete(task);
    }

    /** Abandons in-flight optional stages and drains required ones so they make no new calls. */
    private void stopInFlightStages(TaskRun run) {
        List<StageExecution> toCancel = new ArrayList<>();
        List<StageExecution> toDrain = new ArrayList<>();
        synchronized (run) {
            for (var entry : run.inFlight().entrySet()) {
                if (graph.stage(entry.getKey()).required()) {
                    toDrain.add(entry.getValue());
                } else {
                    toCancel.add(entry.getValue());
                }
            }
        }
        toCancel.forEach(execution -> execution.cancel(true));
        toDrain.forEach(StageExecution::drain);
    }

    private void failUnexpectedly(TaskRun run, Throwable error) {
        Throwable cause = AgentErrorClassifier.unwrap(error);
        log.error("Unexpected error driving task {}", run.taskId(), cause);
        try {
            PipelineTask task = store.apply(run.taskId(), new TaskFailed(new TaskError(null, ErrorKind.FATAL,
                    "internal error: " + cause.getMessage(), null)));
            stopInFlightStages(run);
            onTerminal(run, task);
        } catch (RuntimeException e) {
            log.error("Could not record failure of task {}", run.taskId(), e);
            if (run.claimTerminal()) {
                runs.remove(run.taskId(), run);
                run.terminal().completeExceptionally(e);
            }
        }
    }

    private String failedDependencies(PipelineTask task, StageDefinition stage) {
        var names = new ArrayList<String>();
        for (var dep : stage.dependsOn()) {
            var status = task.stage(dep).status();
            if (status == StageStatus.FAILED || status == StageStatus.SKIPPED) {
                names.add(dep + " " + status.name().toLowerCase(Locale.ROOT));
            }
        }
        return String.join(", ", names);
    }

    private static Map<String, Object> errorPayload(TaskError error) {
        var payload = new HashMap<String, Object>();
        if (error != null) {
            payload.put("kind", error.kind().name());
            payload.put("message", error.message() != null ? error.message() : "");
            if (error.unitId() != null) {
                payload.put("unitId", error.unitId());
            }
        }
        return payload;
    }

    private void publish(String eventType, PipelineTask task, String stageName, String status,
                         Map<String, Object> payload) {
        eventBus.publish(new PipelineEvent(eventType, task.id(), stageName, status, task.progress(),
                payload, Instant.now()));
    }
}
