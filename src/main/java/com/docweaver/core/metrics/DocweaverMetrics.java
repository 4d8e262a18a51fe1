package com.docweaver.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for document generation.
 */
@Service
public class DocweaverMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeTasks = new AtomicInteger();

    public DocweaverMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("docweaver.tasks.active", activeTasks, AtomicInteger::get)
                .description("Tasks currently pending or running")
                .register(registry);
    }

    public void taskStarted() {
        activeTasks.incrementAndGet();
    }

    /**
     * Records a task reaching a terminal status.
     *
     * @param template template kind of the task
     * @param status   terminal status name
     * @param ms       time from submission to terminal transition
     */
    public void recordTaskResult(String template, String status, long ms) {
        activeTasks.decrementAndGet();
        Counter.builder("docweaver.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("docweaver.task.duration")
                .tag("template", template)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAgentCall(String role, String outcome, long ms) {
        Counter.builder("docweaver.agent.calls")
                .tag("role", role)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("docweaver.agent.duration")
                .tag("role", role)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String role) {
        Counter.builder("docweaver.unit.retries")
                .description("Unit attempts retried after a transient failure")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    public void recordStageDuration(String stage, String status, long ms) {
        Timer.builder("docweaver.stage.duration")
                .tag("stage", stage)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Exposes the number of units currently holding a slot of the global budget.
     */
    public void registerBudgetGauge(Supplier<Number> inFlight) {
        Gauge.builder("docweaver.budget.in_flight", inFlight)
                .description("Units in flight against the global concurrency budget")
                .register(registry);
    }

    public int activeTasks() {
        return activeTasks.get();
    }
}
