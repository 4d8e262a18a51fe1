package com.docweaver.core.executor;

import com.docweaver.core.gateway.AgentErrorClassifier;
import com.docweaver.core.gateway.AgentGateway;
import com.docweaver.core.gateway.AgentRequest;
import com.docweaver.core.gateway.AgentResponse;
import com.docweaver.core.gateway.TransientAgentException;
import com.docweaver.core.graph.DraftContribution;
import com.docweaver.core.graph.PlannedUnit;
import com.docweaver.core.graph.StageDefinition;
import com.docweaver.core.graph.UnitSuccess;
import com.docweaver.core.logging.MdcContext;
import com.docweaver.core.metrics.DocweaverMetrics;
import com.docweaver.core.model.ErrorKind;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.UnitOutcome;
import com.docweaver.core.model.UnitTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the units of one stage against the {@link AgentGateway}.
 *
 * <p>Each unit takes a slot from the task's budget and then from the global budget before
 * every attempt, and gives both back when the attempt ends, so a unit waiting out a backoff
 * holds no slot. Attempts are bounded by the unit timeout; timeouts count as transient.
 * Transient failures are retried according to the {@link RetryPolicy}; backoff delays are
 * scheduled on the shared scheduler, never slept.
 *
 * <p>A required stage fails on its first terminal unit failure and abandons its remaining
 * units. An optional stage runs every unit and merges whatever succeeded; it fails only if
 * every unit failed.
 *
 * <p>A drained stage ({@link StageExecution#drain()}) lets calls already in flight finish but
 * settles every unit that fails or is still waiting without a further attempt.
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final AgentGateway gateway;
    private final ConcurrencyBudget globalBudget;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final Duration unitTimeout;
    private final DocweaverMetrics metrics;

    public StageExecutor(AgentGateway gateway, ConcurrencyBudget globalBudget, RetryPolicy retryPolicy,
                         ScheduledExecutorService scheduler, Duration unitTimeout, DocweaverMetrics metrics) {
        this.gateway = gateway;
        this.globalBudget = globalBudget;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.unitTimeout = unitTimeout;
        this.metrics = metrics;
    }

    public ConcurrencyBudget globalBudget() {
        return globalBudget;
    }

    /**
     * Runs {@code stage} for the task captured in {@code snapshot}.
     *
     * <p>The returned future never completes exceptionally: planning, agent and merge failures
     * all surface as a FAILED {@link StageResult}. Cancelling it abandons every unit that is
     * still waiting or in flight; draining it stops retries.
     */
    public StageExecution runStage(StageDefinition stage, PipelineTask snapshot,
                                                   ConcurrencyBudget taskBudget) {
        List<PlannedUnit> planned;
        try {
            planned = stage.planner().plan(snapshot);
        } catch (RuntimeException e) {
            log.error("Stage {} could not plan its units for task {}: {}", stage.name(), snapshot.id(),
                    e.getMessage());
            return StageExecution.completed(StageResult.failed(stage.name(),
                    new TaskError(stage.name(), ErrorKind.FATAL, "planning failed: " + e.getMessage(), null),
                    List.of(), List.of()));
        }

        var run = new StageRun(stage, snapshot, planned, taskBudget);
        run.result.whenComplete((result, error) -> {
            if (run.result.isCancelled()) {
                run.abandon("stage " + stage.name() + " abandoned");
            }
        });

        if (planned.isEmpty()) {
            log.info("Stage {} has no units for task {}", stage.name(), snapshot.id());
            run.finish();
            return run.result;
        }

        log.info("Stage {} dispatching {} unit(s) for task {} [{}]", stage.name(), planned.size(),
                snapshot.id(), stage.required() ? "required" : "optional");
        for (var work : run.units) {
            work.completion().whenComplete((w, e) -> run.onUnitDone(w));
            attempt(run, work);
        }
        return run.result;
    }

    private void attempt(StageRun run, UnitOfWork work) {
        if (work.isDone()) {
            return;
        }
        if (run.result.isDraining()) {
            work.cancel("stage " + run.stage.name() + " drained");
            return;
        }
        var taskSlot = run.taskBudget.acquire();
        work.track(taskSlot);
        taskSlot.thenAccept(taskPermit -> {
            if (work.isDone()) {
                taskPermit.release();
                return;
            }
            var globalSlot = globalBudget.acquire();
            work.track(globalSlot);
            globalSlot.whenComplete((globalPermit, error) -> {
                if (error != null) {
                    taskPermit.release();
                    return;
                }
                if (work.isDone()) {
                    globalPermit.release();
                    taskPermit.release();
                    return;
                }
                invoke(run, work, taskPermit, globalPermit);
            });
        });
    }

    private void invoke(StageRun run, UnitOfWork work,
                        ConcurrencyBudget.Permit taskPermit, ConcurrencyBudget.Permit globalPermit) {
        StageDefinition stage = run.stage;
        String taskId = run.snapshot.id();
        int attempt = work.beginAttempt();
        if (attempt == 0) {
            globalPermit.release();
            taskPermit.release();
            return;
        }
        MdcContext.setUnit(taskId, stage.name(), work.unitId());
        try {
            log.debug("Unit {} attempt {}/{}", work.unitId(), attempt, retryPolicy.maxAttempts());
        } finally {
            MdcContext.clear();
        }

        CompletableFuture<AgentResponse> call;
        try {
            call = gateway.invoke(stage.role(), work.request());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        var timed = withTimeout(call, stage, work.unitId());
        work.track(timed);

        timed.whenComplete((response, error) -> {
            globalPermit.release();
            taskPermit.release();
            work.endAttempt();
            if (work.isDone()) {
                return;
            }
            if (error == null) {
                work.succeed(response);
                return;
            }
            Throwable cause = AgentErrorClassifier.unwrap(error);
            MdcContext.setUnit(taskId, stage.name(), work.unitId());
            try {
                if (run.result.isDraining()) {
                    log.info("Unit {} attempt {} failed ({}) after stage {} was drained, not retrying",
                            work.unitId(), attempt, cause.getMessage(), stage.name());
                    work.cancel("stage " + stage.name() + " drained after: " + cause.getMessage());
                } else if (retryPolicy.shouldRetry(attempt, cause)) {
                    Duration delay = retryPolicy.delayAfter(attempt);
                    work.recordBackoff(delay.toMillis());
                    metrics.recordRetry(stage.role().wireName());
                    log.warn("Unit {} attempt {} failed ({}), retrying in {}ms", work.unitId(), attempt,
                            cause.getMessage(), delay.toMillis());
                    work.track(scheduler.schedule(() -> attempt(run, work),
                            delay.toMillis(), TimeUnit.MILLISECONDS));
                } else {
                    log.warn("Unit {} failed after {} attempt(s): {}", work.unitId(), attempt, cause.getMessage());
                    work.fail(cause);
                }
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Bounds one attempt. On expiry the agent call is cancelled and the attempt fails with a
     * transient timeout.
     */
    private CompletableFuture<AgentResponse> withTimeout(CompletableFuture<AgentResponse> call,
                                                        StageDefinition stage, String unitId) {
        var timed = new CompletableFuture<AgentResponse>();
        var timer = scheduler.schedule(() -> {
            if (timed.completeExceptionally(new TransientAgentException(TransientAgentException.TIMEOUT,
                    stage.role().wireName() + " timed out after " + unitTimeout.toMillis() + "ms on " + unitId))) {
                call.cancel(true);
            }
        }, unitTimeout.toMillis(), TimeUnit.MILLISECONDS);

        call.whenComplete((response, error) -> {
            timer.cancel(false);
            if (error != null) {
                timed.completeExceptionally(error);
            } else {
                timed.complete(response);
            }
        });
        timed.whenComplete((response, error) -> {
            if (timed.isCancelled()) {
                timer.cancel(false);
                call.cancel(true);
            }
        });
        return timed;
    }

    /**
     * Fan-in state of one stage run.
     */
    private final class StageRun {

        private final StageDefinition stage;
        private final PipelineTask snapshot;
        private final ConcurrencyBudget taskBudget;
        private final List<UnitOfWork> units = new ArrayList<>();
        private final StageExecution result = new StageExecution(this::drain);
        private final long startMs = System.currentTimeMillis();
        private int remaining;
        private UnitOfWork firstFailure;

        StageRun(StageDefinition stage, PipelineTask snapshot, List<PlannedUnit> planned,
                 ConcurrencyBudget taskBudget) {
            this.stage = stage;
            this.snapshot = snapshot;
            this.taskBudget = taskBudget;
            for (var unit : planned) {
                var request = new AgentRequest(stage.role(), snapshot.id(), unit.unitId(), unit.input());
                units.add(new UnitOfWork(stage.name(), unit, request));
            }
            this.remaining = units.size();
        }

        void onUnitDone(UnitOfWork work) {
            boolean failFast = false;
            boolean last;
            synchronized (this) {
                remaining--;
                if (work.outcome() == UnitOutcome.FAILED && firstFailure == null) {
                    firstFailure = work;
                    failFast = stage.required();
                }
                last = remaining == 0;
            }
            if (failFast) {
                log.warn("Required stage {} failing fast on unit {} for task {}", stage.name(), work.unitId(),
                        snapshot.id());
                abandon("sibling unit " + work.unitId() + " failed");
            }
            if (last) {
                finish();
            }
        }

        void abandon(String reason) {
            for (var work : units) {
                work.cancel(reason);
            }
        }

        void drain() {
            int idle = 0;
            for (var work : units) {
                if (work.cancelIfIdle("stage " + stage.name() + " drained")) {
                    idle++;
                }
            }
            log.info("Stage {} drained for task {}: {} waiting unit(s) settled, in-flight calls left to finish",
                    stage.name(), snapshot.id(), idle);
        }

        void finish() {
            var telemetry = new ArrayList<UnitTelemetry>();
            var failedUnits = new ArrayList<String>();
            var successes = new ArrayList<UnitSuccess>();
            for (var work : units) {
                telemetry.add(work.telemetry());
                if (work.outcome() == UnitOutcome.SUCCEEDED) {
                    successes.add(new UnitSuccess(work.unit(), work.response()));
                } else if (work.outcome() == UnitOutcome.FAILED) {
                    failedUnits.add(work.unitId());
                }
            }

            StageResult stageResult;
            UnitOfWork failure;
            synchronized (this) {
                failure = firstFailure;
            }
            boolean failed = stage.required()
                    ? failure != null || successes.size() < units.size()
                    : !units.isEmpty() && successes.isEmpty();

            if (failed) {
                TaskError error = failure != null ? failure.error()
                        : new TaskError(stage.name(), ErrorKind.CANCELLED, "stage abandoned", null);
                stageResult = StageResult.failed(stage.name(), error, failedUnits, telemetry);
            } else {
                stageResult = merge(successes, failedUnits, telemetry);
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            metrics.recordStageDuration(stage.name(), stageResult.outcome().name().toLowerCase(Locale.ROOT), elapsedMs);
            MdcContext.setStage(snapshot.id(), stage.name());
            try {
                if (stageResult.succeeded()) {
                    log.info("Stage {} done in {}ms ({} unit(s), {} failed)", stage.name(), elapsedMs,
                            units.size(), failedUnits.size());
                } else {
                    log.warn("Stage {} failed in {}ms: {}", stage.name(), elapsedMs,
                            stageResult.error().summary());
                }
            } finally {
                MdcContext.clear();
            }
            result.complete(stageResult);
        }

        private StageResult merge(List<UnitSuccess> successes, List<String> failedUnits,
                                  List<UnitTelemetry> telemetry) {
            try {
                DraftContribution contribution = stage.merger().merge(snapshot, successes);
                return StageResult.done(stage.name(), contribution, failedUnits, telemetry);
            } catch (RuntimeException e) {
                return StageResult.failed(stage.name(),
                        new TaskError(stage.name(), ErrorKind.FATAL, "malformed output: " + e.getMessage(), null),
                        failedUnits, telemetry);
            }
        }
    }
}
