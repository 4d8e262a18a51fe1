package com.docweaver.core.state;

import com.docweaver.core.executor.StageResult;
import com.docweaver.core.graph.DocumentPipeline;
import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.ContentBlock;
import com.docweaver.core.model.ErrorKind;
import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.ImageStyle;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.TaskStatus;
import com.docweaver.core.model.TemplateKind;
import com.docweaver.core.model.UnitOutcome;
import com.docweaver.core.model.UnitTelemetry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a throwaway PostgreSQL container; skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcTaskStateStoreTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static HikariDataSource dataSource;

    private final PipelineGraph graph = DocumentPipeline.createDefault();
    private JdbcTaskStateStore store;

    @BeforeAll
    static void startDataSource() {
        var config = new HikariConfig();
        config.setJdbcUrl(POSTGRES.getJdbcUrl());
        config.setUsername(POSTGRES.getUsername());
        config.setPassword(POSTGRES.getPassword());
        config.setMaximumPoolSize(4);
        dataSource = new HikariDataSource(config);
    }

    @AfterAll
    static void closeDataSource() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        store = new JdbcTaskStateStore(dataSource, graph);
        store.createTables();
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM docweaver_tasks");
        }
    }

    private static GenerationRequest request(String topic) {
        return new GenerationRequest(topic,
                new GenerationConfig(TemplateKind.ACADEMIC, 4, 2, false, ImageStyle.INFOGRAPHIC));
    }

    @Test
    @DisplayName("created task round-trips through the table")
    void createAndGet() {
        var task = store.create(request("quantum sensing"));

        var loaded = store.get(task.id()).orElseThrow();

        assertEquals(task.id(), loaded.id());
        assertEquals(TaskStatus.PENDING, loaded.status());
        assertEquals(TemplateKind.ACADEMIC, loaded.config().templateKind());
        assertEquals(List.of("research", "structure", "write", "image"), List.copyOf(loaded.stages().keySet()));
        assertTrue(store.get("DOC-missing").isEmpty());
    }

    @Test
    @DisplayName("applied transitions persist stage telemetry and draft")
    void applyPersists() {
        var task = store.create(request("quantum sensing"));
        store.apply(task.id(), new TaskStarted());
        store.apply(task.id(), new StageStarted("research"));
        var telemetry = new UnitTelemetry("research-0", UnitOutcome.SUCCEEDED, 2, List.of(500L), null, 1200);

        store.apply(task.id(), StageResult.done("research",
                draft -> draft.withContentBlocks(List.of(new ContentBlock(0, "Intro", "text"))),
                List.of(), List.of(telemetry)));

        PipelineTask loaded = store.get(task.id()).orElseThrow();
        assertEquals(TaskStatus.RUNNING, loaded.status());
        assertEquals(StageStatus.DONE, loaded.stage("research").status());
        assertEquals(StageStatus.SKIPPED, loaded.stage("image").status());
        assertEquals(List.of(500L), loaded.stage("research").units().get(0).backoffDelaysMs());
        assertEquals("text", loaded.draft().contentBlocks().get(0).body());
        assertTrue(loaded.progress() > 0);
    }

    @Test
    @DisplayName("terminal tasks are not modified further")
    void terminalIgnored() {
        var task = store.create(request("quantum sensing"));
        store.apply(task.id(), new TaskStarted());
        store.apply(task.id(), new TaskFailed(new TaskError("write", ErrorKind.FATAL, "rejected", "write-1")));

        var after = store.apply(task.id(), new StageStarted("research"));

        assertEquals(TaskStatus.FAILED, after.status());
        assertEquals(StageStatus.PENDING, after.stage("research").status());
        assertEquals("write-1", store.get(task.id()).orElseThrow().error().unitId());
    }

    @Test
    @DisplayName("unknown id throws TaskNotFoundException")
    void unknownId() {
        assertThrows(TaskNotFoundException.class, () -> store.apply("DOC-missing", new TaskStarted()));
    }

    @Test
    @DisplayName("unfinished tasks are listed only for the instance that created them")
    void ownedUnfinishedScopedToInstance() throws Exception {
        var nodeA = new JdbcTaskStateStore(dataSource, graph, "node-a");
        var nodeB = new JdbcTaskStateStore(dataSource, graph, "node-b");
        nodeA.createTables();
        var pendingA = nodeA.create(request("a pending"));
        var failedA = nodeA.create(request("a failed"));
        nodeA.apply(failedA.id(), new TaskFailed(new TaskError(null, ErrorKind.FATAL, "boom", null)));
        var runningB = nodeB.create(request("b running"));
        nodeB.apply(runningB.id(), new TaskStarted());

        assertEquals(List.of(pendingA.id()), nodeA.listOwnedUnfinished().stream().map(PipelineTask::id).toList());
        assertEquals(List.of(runningB.id()), nodeB.listOwnedUnfinished().stream().map(PipelineTask::id).toList());
        assertEquals(3, nodeA.list().size());
    }

    @Test
    @DisplayName("list returns every task")
    void listAll() {
        store.create(request("a"));
        store.create(request("b"));

        assertEquals(2, store.list().size());
    }
}
