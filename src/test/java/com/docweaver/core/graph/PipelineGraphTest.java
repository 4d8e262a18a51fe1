package com.docweaver.core.graph;

import com.docweaver.core.gateway.AgentRole;
import com.docweaver.core.model.StageStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineGraphTest {

    private static StageDefinition.Builder stage(String name) {
        return StageDefinition.builder(name, AgentRole.WRITE)
                .planner(task -> List.of())
                .merger((task, successes) -> DraftContribution.none());
    }

    private static List<String> names(List<StageDefinition> stages) {
        return stages.stream().map(StageDefinition::name).toList();
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects an empty pipeline")
        void rejectsEmpty() {
            assertThrows(PipelineConfigurationException.class, () -> new PipelineGraph(List.of(), 1.0));
        }

        @Test
        @DisplayName("rejects duplicate stage names")
        void rejectsDuplicates() {
            var ex = assertThrows(PipelineConfigurationException.class,
                    () -> new PipelineGraph(List.of(stage("a").build(), stage("a").build()), 1.0));
            assertTrue(ex.getMessage().contains("Duplicate"));
        }

        @Test
        @DisplayName("rejects unknown dependencies")
        void rejectsUnknownDependency() {
            var ex = assertThrows(PipelineConfigurationException.class,
                    () -> new PipelineGraph(List.of(stage("a").dependsOn("ghost").build()), 1.0));
            assertTrue(ex.getMessage().contains("ghost"));
        }

        @Test
        @DisplayName("rejects a cycle and names its stages")
        void rejectsCycle() {
            var ex = assertThrows(PipelineConfigurationException.class, () -> new PipelineGraph(List.of(
                    stage("root").build(),
                    stage("a").dependsOn("root", "b").build(),
                    stage("b").dependsOn("a").build()), 1.0));
            assertTrue(ex.getMessage().contains("cycle"));
            assertTrue(ex.getMessage().contains("a"));
            assertTrue(ex.getMessage().contains("b"));
            assertFalse(ex.getMessage().contains("root"));
        }

        @Test
        @DisplayName("rejects a required stage depending on an optional one")
        void rejectsRequiredOnOptional() {
            assertThrows(PipelineConfigurationException.class, () -> new PipelineGraph(List.of(
                    stage("extra").optional().build(),
                    stage("core").dependsOn("extra").build()), 1.0));
        }

        @Test
        @DisplayName("rejects non-positive stage weights and negative assembly weight")
        void rejectsBadWeights() {
            assertThrows(PipelineConfigurationException.class,
                    () -> new PipelineGraph(List.of(stage("a").weight(0).build()), 1.0));
            assertThrows(PipelineConfigurationException.class,
                    () -> new PipelineGraph(List.of(stage("a").build()), -1.0));
        }

        @Test
        @DisplayName("topological order puts dependencies first")
        void topologicalOrder() {
            var graph = new PipelineGraph(List.of(
                    stage("write").dependsOn("outline").build(),
                    stage("outline").dependsOn("research").build(),
                    stage("research").build()), 1.0);

            assertEquals(List.of("research", "outline", "write"), graph.topologicalOrder());
        }

        @Test
        @DisplayName("stage() rejects unknown names")
        void unknownStage() {
            var graph = new PipelineGraph(List.of(stage("a").build()), 1.0);
            assertThrows(IllegalArgumentException.class, () -> graph.stage("b"));
        }
    }

    @Nested
    @DisplayName("scheduling queries")
    class Queries {

        private final PipelineGraph graph = new PipelineGraph(List.of(
                stage("research").build(),
                stage("structure").dependsOn("research").build(),
                stage("write").dependsOn("structure").weight(3).build(),
                stage("image").dependsOn("structure").optional().build()), 1.0);

        @Test
        @DisplayName("only root stages are ready initially")
        void initialReady() {
            assertEquals(List.of("research"), names(graph.readyStages(Map.of())));
        }

        @Test
        @DisplayName("independent stages become ready together once their dependency is DONE")
        void fanOutReady() {
            var statuses = Map.of(
                    "research", StageStatus.DONE,
                    "structure", StageStatus.DONE);
            assertEquals(List.of("write", "image"), names(graph.readyStages(statuses)));
        }

        @Test
        @DisplayName("running or failed dependencies do not unlock downstream stages")
        void notReadyWhileRunning() {
            assertTrue(graph.readyStages(Map.of("research", StageStatus.RUNNING)).isEmpty());
            assertTrue(graph.readyStages(Map.of("research", StageStatus.FAILED)).isEmpty());
        }

        @Test
        @DisplayName("stages behind a failed or skipped dependency are blocked")
        void blocked() {
            var statuses = Map.of("research", StageStatus.FAILED);
            assertEquals(List.of("structure"), names(graph.blockedStages(statuses)));

            var skipped = Map.of(
                    "research", StageStatus.DONE,
                    "structure", StageStatus.SKIPPED);
            assertEquals(List.of("write", "image"), names(graph.blockedStages(skipped)));
        }

        @Test
        @DisplayName("settled only when no stage is pending or running")
        void settled() {
            assertFalse(graph.isSettled(Map.of(
                    "research", StageStatus.DONE,
                    "structure", StageStatus.DONE,
                    "write", StageStatus.RUNNING,
                    "image", StageStatus.SKIPPED)));
            assertTrue(graph.isSettled(Map.of(
                    "research", StageStatus.DONE,
                    "structure", StageStatus.DONE,
                    "write", StageStatus.DONE,
                    "image", StageStatus.FAILED)));
        }

        @Test
        @DisplayName("settled fraction is weighted and leaves room for assembly")
        void settledFraction() {
            assertEquals(7.0, graph.totalWeight());
            assertEquals(0.0, graph.settledFraction(Map.of()));
            assertEquals(2.0 / 7.0, graph.settledFraction(Map.of(
                    "research", StageStatus.DONE,
                    "structure", StageStatus.DONE)), 1e-9);
            assertEquals(6.0 / 7.0, graph.settledFraction(Map.of(
                    "research", StageStatus.DONE,
                    "structure", StageStatus.DONE,
                    "write", StageStatus.DONE,
                    "image", StageStatus.SKIPPED)), 1e-9);
        }
    }
}
