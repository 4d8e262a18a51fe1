package com.docweaver.core.executor;

import com.docweaver.core.gateway.AgentBackend;
import com.docweaver.core.gateway.AgentErrorClassifier;
import com.docweaver.core.gateway.AgentGateway;
import com.docweaver.core.gateway.AgentResponse;
import com.docweaver.core.gateway.AgentRole;
import com.docweaver.core.gateway.FatalAgentException;
import com.docweaver.core.gateway.TransientAgentException;
import com.docweaver.core.graph.DraftContribution;
import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.graph.PlannedUnit;
import com.docweaver.core.graph.StageDefinition;
import com.docweaver.core.metrics.DocweaverMetrics;
import com.docweaver.core.model.ContentBlock;
import com.docweaver.core.model.DocumentDraft;
import com.docweaver.core.model.ErrorKind;
import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.ImageStyle;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;
import com.docweaver.core.model.TemplateKind;
import com.docweaver.core.model.UnitOutcome;
import com.docweaver.core.model.UnitTelemetry;
import com.docweaver.core.state.TaskTransitions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StageExecutorTest {

    private ScheduledExecutorService scheduler;
    private SimpleMeterRegistry registry;
    private DocweaverMetrics metrics;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(4);
        registry = new SimpleMeterRegistry();
        metrics = new DocweaverMetrics(registry);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    // ── fixtures ────────────────────────────────────────────────────

    private static StageDefinition stage(int units, boolean required) {
        var builder = StageDefinition.builder("write", AgentRole.WRITE)
                .planner(task -> {
                    var planned = new ArrayList<PlannedUnit>();
                    for (int i = 0; i < units; i++) {
                        planned.add(new PlannedUnit("write-" + i, i, Map.of("section_index", i)));
                    }
                    return planned;
                })
                .merger((task, successes) -> {
                    var blocks = new ArrayList<ContentBlock>();
                    for (var success : successes) {
                        blocks.add(new ContentBlock(success.unit().index(), "s" + success.unit().index(),
                                String.valueOf(success.response().output().get("content"))));
                    }
                    return draft -> draft.withContentBlocks(blocks);
                });
        if (!required) {
            builder.optional();
        }
        return builder.build();
    }

    private static PipelineTask snapshot(StageDefinition stage) {
        var graph = new PipelineGraph(List.of(stage), 1.0);
        var config = new GenerationConfig(TemplateKind.STANDARD, 5, 8, false, ImageStyle.ABSTRACT);
        return TaskTransitions.newTask("DOC-2026-exec0001", new GenerationRequest("topic", config), graph,
                Instant.now());
    }

    private StageExecutor executor(AgentBackend backend, int globalLimit, Duration unitTimeout) {
        var gateway = new AgentGateway(Map.of(AgentRole.WRITE, backend), new AgentErrorClassifier(), metrics);
        var retry = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Duration.ofMillis(50), null);
        return new StageExecutor(gateway, new ConcurrencyBudget("global", globalLimit), retry, scheduler,
                unitTimeout, metrics);
    }

    private StageExecutor executor(AgentBackend backend) {
        return executor(backend, 8, Duration.ofSeconds(5));
    }

    private static CompletableFuture<AgentResponse> ok(String unitId, String content) {
        return CompletableFuture.completedFuture(new AgentResponse(AgentRole.WRITE, unitId, Map.of("content", content)));
    }

    private static StageResult run(StageExecutor executor, StageDefinition stage) {
        return executor.runStage(stage, snapshot(stage), new ConcurrencyBudget("task", 8))
                .orTimeout(10, TimeUnit.SECONDS)
                .join();
    }

    private static UnitTelemetry telemetry(StageResult result, String unitId) {
        return result.telemetry().stream().filter(t -> t.unitId().equals(unitId)).findFirst().orElseThrow();
    }

    // ── tests ───────────────────────────────────────────────────────

    @Test
    @DisplayName("all units succeed -> DONE with merged contribution in unit order")
    void allUnitsSucceed() {
        var stage = stage(3, true);
        var result = run(executor(request -> ok(request.unitId(), "body " + request.unitId())), stage);

        assertEquals(StageStatus.DONE, result.outcome());
        assertNull(result.error());
        var blocks = result.contribution().applyTo(DocumentDraft.empty()).contentBlocks();
        assertEquals(List.of(0, 1, 2), blocks.stream().map(ContentBlock::sectionIndex).toList());
        assertEquals("body write-1", blocks.get(1).body());
        assertTrue(result.telemetry().stream().allMatch(t -> t.attempts() == 1));
    }

    @Test
    @DisplayName("stage with no units completes DONE")
    void noUnits() {
        var result = run(executor(request -> ok(request.unitId(), "x")), stage(0, true));

        assertEquals(StageStatus.DONE, result.outcome());
        assertTrue(result.telemetry().isEmpty());
    }

    @Test
    @DisplayName("transient failure is retried with backoff and then succeeds")
    void transientThenSuccess() {
        var calls = new AtomicInteger();
        AgentBackend backend = request -> calls.incrementAndGet() == 1
                ? CompletableFuture.failedFuture(new TransientAgentException(TransientAgentException.RATE_LIMITED,
                "rate limited"))
                : ok(request.unitId(), "done");

        var result = run(executor(backend), stage(1, true));

        assertEquals(StageStatus.DONE, result.outcome());
        var unit = telemetry(result, "write-0");
        assertEquals(2, unit.attempts());
        assertEquals(List.of(10L), unit.backoffDelaysMs());
        assertEquals(1.0, registry.find("docweaver.unit.retries").tag("role", "write").counter().count());
    }

    @Test
    @DisplayName("transient failures exhaust retries -> FAILED with TRANSIENT kind")
    void retriesExhausted() {
        var calls = new AtomicInteger();
        AgentBackend backend = request -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new java.io.IOException("connection reset"));
        };

        var result = run(executor(backend), stage(1, true));

        assertEquals(StageStatus.FAILED, result.outcome());
        assertEquals(ErrorKind.TRANSIENT, result.error().kind());
        assertEquals("write-0", result.error().unitId());
        assertEquals(3, calls.get());
        assertEquals(List.of(10L, 20L), telemetry(result, "write-0").backoffDelaysMs());
        assertEquals(List.of("write-0"), result.failedUnits());
    }

    @Test
    @DisplayName("required stage fails fast on a fatal unit and abandons its siblings")
    void requiredFailsFast() {
        AgentBackend backend = request -> request.unitId().equals("write-1")
                ? CompletableFuture.failedFuture(new FatalAgentException(FatalAgentException.REJECTED, "bad brief"))
                : new CompletableFuture<>(); // never answers

        var result = run(executor(backend), stage(3, true));

        assertEquals(StageStatus.FAILED, result.outcome());
        assertEquals(ErrorKind.FATAL, result.error().kind());
        assertEquals("write-1", result.error().unitId());
        assertEquals(1, telemetry(result, "write-1").attempts());
        assertEquals(UnitOutcome.CANCELLED, telemetry(result, "write-0").outcome());
        assertEquals(UnitOutcome.CANCELLED, telemetry(result, "write-2").outcome());
    }

    @Test
    @DisplayName("optional stage completes without its failed units")
    void optionalPartialFailure() {
        AgentBackend backend = request -> request.unitId().equals("write-0")
                ? CompletableFuture.failedFuture(new FatalAgentException(FatalAgentException.FAILED, "no image"))
                : ok(request.unitId(), "ok");

        var result = run(executor(backend), stage(3, false));

        assertEquals(StageStatus.DONE, result.outcome());
        assertEquals(List.of("write-0"), result.failedUnits());
        assertEquals(2, result.contribution().applyTo(DocumentDraft.empty()).contentBlocks().size());
    }

    @Test
    @DisplayName("optional stage fails only when every unit failed")
    void optionalAllFailed() {
        AgentBackend backend = request ->
                CompletableFuture.failedFuture(new FatalAgentException(FatalAgentException.FAILED, "down"));

        var result = run(executor(backend), stage(2, false));

        assertEquals(StageStatus.FAILED, result.outcome());
        assertEquals(List.of("write-0", "write-1"), result.failedUnits());
    }

    @Test
    @DisplayName("attempt timeout counts as transient and is retried")
    void timeoutRetried() {
        var calls = new AtomicInteger();
        AgentBackend backend = request -> calls.incrementAndGet() == 1
                ? new CompletableFuture<>()
                : ok(request.unitId(), "late");

        var result = run(executor(backend, 8, Duration.ofMillis(100)), stage(1, true));

        assertEquals(StageStatus.DONE, result.outcome());
        assertEquals(2, telemetry(result, "write-0").attempts());
    }

    @Test
    @DisplayName("global budget bounds units in flight")
    void globalBudgetBounds() {
        var current = new AtomicInteger();
        var max = new AtomicInteger();
        AgentBackend backend = request -> {
            int now = current.incrementAndGet();
            max.accumulateAndGet(now, Math::max);
            var response = new CompletableFuture<AgentResponse>();
            scheduler.schedule(() -> {
                current.decrementAndGet();
                response.complete(new AgentResponse(AgentRole.WRITE, request.unitId(), Map.of("content", "x")));
            }, 30, TimeUnit.MILLISECONDS);
            return response;
        };
        var executor = executor(backend, 2, Duration.ofSeconds(5));

        var result = run(executor, stage(6, true));

        assertEquals(StageStatus.DONE, result.outcome());
        assertTrue(max.get() <= 2, "max in flight was " + max.get());
        assertEquals(2, executor.globalBudget().peak());
        assertEquals(0, executor.globalBudget().inFlight());
    }

    @Test
    @DisplayName("task budget bounds units in flight independently of the global budget")
    void taskBudgetBounds() {
        var inFlight = new ConcurrentHashMap<String, Boolean>();
        var max = new AtomicInteger();
        AgentBackend backend = request -> {
            inFlight.put(request.unitId(), true);
            max.accumulateAndGet(inFlight.size(), Math::max);
            var response = new CompletableFuture<AgentResponse>();
            scheduler.schedule(() -> {
                inFlight.remove(request.unitId());
                response.complete(new AgentResponse(AgentRole.WRITE, request.unitId(), Map.of("content", "x")));
            }, 20, TimeUnit.MILLISECONDS);
            return response;
        };
        var stage = stage(5, true);

        var result = executor(backend).runStage(stage, snapshot(stage), new ConcurrencyBudget("task", 1))
                .orTimeout(10, TimeUnit.SECONDS).join();

        assertEquals(StageStatus.DONE, result.outcome());
        assertEquals(1, max.get());
    }

    @Test
    @DisplayName("merge failure -> FAILED with malformed output")
    void mergeFailure() {
        var stage = StageDefinition.builder("write", AgentRole.WRITE)
                .planner(task -> List.of(new PlannedUnit("write-0", 0, Map.of())))
                .merger((task, successes) -> {
                    throw new IllegalStateException("no content");
                })
                .build();

        var result = run(executor(request -> ok(request.unitId(), "x")), stage);

        assertEquals(StageStatus.FAILED, result.outcome());
        assertEquals(ErrorKind.FATAL, result.error().kind());
        assertTrue(result.error().message().startsWith("malformed output"));
    }

    @Test
    @DisplayName("cancelling the stage future abandons waiting units")
    void cancelAbandons() {
        var started = new AtomicInteger();
        AgentBackend backend = request -> {
            started.incrementAndGet();
            return new CompletableFuture<>();
        };
        var stage = stage(4, true);
        var executor = executor(backend, 1, Duration.ofSeconds(30));

        var future = executor.runStage(stage, snapshot(stage), new ConcurrencyBudget("task", 4));
        future.cancel(true);

        assertTrue(future.isCancelled());
        assertEquals(1, started.get());
        assertEquals(0, executor.globalBudget().waiting());
    }

    @Test
    @DisplayName("draining settles waiting units and lets the in-flight call fail without a retry")
    void drainStopsRetries() {
        var calls = new CopyOnWriteArrayList<CompletableFuture<AgentResponse>>();
        AgentBackend backend = request -> {
            var response = new CompletableFuture<AgentResponse>();
            calls.add(response);
            return response;
        };
        var stage = stage(3, true);
        var executor = executor(backend, 1, Duration.ofSeconds(30));
        var execution = executor.runStage(stage, snapshot(stage), new ConcurrencyBudget("task", 4));
        assertEquals(1, calls.size());

        execution.drain();

        assertTrue(execution.isDraining());
        assertFalse(execution.isDone());
        assertFalse(calls.get(0).isCancelled());
        assertEquals(0, executor.globalBudget().waiting());

        calls.get(0).completeExceptionally(new TransientAgentException(TransientAgentException.NETWORK, "reset"));
        var result = execution.orTimeout(10, TimeUnit.SECONDS).join();

        assertEquals(1, calls.size());
        assertEquals(StageStatus.FAILED, result.outcome());
        assertEquals(ErrorKind.CANCELLED, result.error().kind());
        assertEquals(1, telemetry(result, "write-0").attempts());
        assertEquals(0, telemetry(result, "write-2").attempts());
        assertTrue(result.telemetry().stream().allMatch(t -> t.outcome() == UnitOutcome.CANCELLED));
        assertEquals(0, executor.globalBudget().inFlight());
    }

    @Test
    @DisplayName("an in-flight call that succeeds after draining still counts")
    void drainKeepsLateSuccess() {
        var response = new CompletableFuture<AgentResponse>();
        var stage = stage(1, true);
        var execution = executor(request -> response).runStage(stage, snapshot(stage),
                new ConcurrencyBudget("task", 4));

        execution.drain();
        response.complete(new AgentResponse(AgentRole.WRITE, "write-0", Map.of("content", "late")));
        var result = execution.orTimeout(10, TimeUnit.SECONDS).join();

        assertEquals(StageStatus.DONE, result.outcome());
        assertEquals(UnitOutcome.SUCCEEDED, telemetry(result, "write-0").outcome());
    }

    @Test
    @DisplayName("stage contribution is a no-op when the stage failed")
    void failedContributionIsNone() {
        AgentBackend backend = request ->
                CompletableFuture.failedFuture(new FatalAgentException(FatalAgentException.FAILED, "x"));
        var result = run(executor(backend), stage(1, true));

        var draft = DocumentDraft.empty();
        assertSame(draft, result.contribution().applyTo(draft));
        assertNotNull(DraftContribution.none());
    }
}
