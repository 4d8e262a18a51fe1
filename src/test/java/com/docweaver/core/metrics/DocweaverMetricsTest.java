package com.docweaver.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DocweaverMetricsTest {

    private SimpleMeterRegistry registry;
    private DocweaverMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DocweaverMetrics(registry);
    }

    @Test
    @DisplayName("active task gauge follows started and finished tasks")
    void activeTasks() {
        metrics.taskStarted();
        metrics.taskStarted();
        metrics.recordTaskResult("standard", "completed", 1200);

        assertEquals(1, metrics.activeTasks());
        assertEquals(1.0, registry.find("docweaver.tasks.active").gauge().value());
    }

    @Test
    @DisplayName("recordTaskResult counts by status and times by template")
    void recordTaskResult() {
        metrics.taskStarted();
        metrics.taskStarted();
        metrics.recordTaskResult("standard", "completed", 100);
        metrics.recordTaskResult("report", "failed", 200);

        assertEquals(1.0, registry.find("docweaver.tasks.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("docweaver.tasks.total").tag("status", "failed").counter().count());
        var timer = registry.find("docweaver.task.duration").tag("template", "report").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordAgentCall tags by role and outcome")
    void recordAgentCall() {
        metrics.recordAgentCall("write", "success", 50);
        metrics.recordAgentCall("write", "transient", 70);
        metrics.recordAgentCall("image", "success", 30);

        assertEquals(1.0, registry.find("docweaver.agent.calls")
                .tag("role", "write").tag("outcome", "transient").counter().count());
        assertEquals(2, registry.find("docweaver.agent.duration").tag("role", "write").timer().count());
    }

    @Test
    @DisplayName("recordRetry increments the per-role retry counter")
    void recordRetry() {
        metrics.recordRetry("research");
        metrics.recordRetry("research");

        assertEquals(2.0, registry.find("docweaver.unit.retries").tag("role", "research").counter().count());
    }

    @Test
    @DisplayName("recordStageDuration creates a timer per stage and status")
    void recordStageDuration() {
        metrics.recordStageDuration("structure", "done", 300);

        var timer = registry.find("docweaver.stage.duration").tag("stage", "structure").tag("status", "done").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("budget gauge reads the supplied value")
    void budgetGauge() {
        var inFlight = new AtomicInteger(3);
        metrics.registerBudgetGauge(inFlight::get);

        assertEquals(3.0, registry.find("docweaver.budget.in_flight").gauge().value());
        inFlight.set(1);
        assertEquals(1.0, registry.find("docweaver.budget.in_flight").gauge().value());
    }
}
