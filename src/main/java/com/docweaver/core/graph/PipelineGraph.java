package com.docweaver.core.graph;

import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares the pipeline's stages and their dependencies, and computes which stages
 * may run next for a given set of stage statuses.
 *
 * <p>Every query is a pure function of the statuses passed in, so the orchestrator can
 * re-evaluate after each state change. Structural problems (duplicate names, unknown or
 * cyclic dependencies, a required stage depending on an optional one) are rejected at
 * construction with {@link PipelineConfigurationException}.
 */
public final class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private final Map<String, StageDefinition> stages;
    private final List<String> topologicalOrder;
    private final double assemblyWeight;

    public PipelineGraph(List<StageDefinition> definitions, double assemblyWeight) {
        if (definitions == null || definitions.isEmpty()) {
            throw new PipelineConfigurationException("Pipeline must declare at least one stage");
        }
        if (assemblyWeight < 0) {
            throw new PipelineConfigurationException("Assembly weight must not be negative");
        }
        var byName = new LinkedHashMap<String, StageDefinition>();
        for (var stage : definitions) {
            if (byName.putIfAbsent(stage.name(), stage) != null) {
                throw new PipelineConfigurationException("Duplicate stage name: " + stage.name());
            }
            if (stage.weight() <= 0) {
                throw new PipelineConfigurationException("Stage " + stage.name() + " must have a positive weight");
            }
        }
        for (var stage : definitions) {
            for (var dep : stage.dependsOn()) {
                var upstream = byName.get(dep);
                if (upstream == null) {
                    throw new PipelineConfigurationException(
                            "Stage " + stage.name() + " depends on unknown stage " + dep);
                }
                if (stage.required() && !upstream.required()) {
                    throw new PipelineConfigurationException(
                            "Required stage " + stage.name() + " cannot depend on optional stage " + dep);
                }
            }
        }
        this.stages = Collections.unmodifiableMap(byName);
        this.topologicalOrder = List.copyOf(sortTopologically(byName));
        this.assemblyWeight = assemblyWeight;
        log.debug("Pipeline graph built: {}", topologicalOrder);
    }

    public List<StageDefinition> stages() {
        return List.copyOf(stages.values());
    }

    public StageDefinition stage(String name) {
        var stage = stages.get(name);
        if (stage == null) {
            throw new IllegalArgumentException("Unknown stage: " + name);
        }
        return stage;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public double assemblyWeight() {
        return assemblyWeight;
    }

    /** Sum of stage weights plus the assembly weight. */
    public double totalWeight() {
        double total = assemblyWeight;
        for (var stage : stages.values()) {
            total += stage.weight();
        }
        return total;
    }

    /**
     * Stages whose dependencies are all DONE and which are themselves still PENDING,
     * in declaration order.
     */
    public List<StageDefinition> readyStages(Map<String, StageStatus> statuses) {
        var ready = new ArrayList<StageDefinition>();
        for (var stage : stages.values()) {
            if (statusOf(statuses, stage.name()) != StageStatus.PENDING) {
                continue;
            }
            boolean satisfied = true;
            for (var dep : stage.dependsOn()) {
                if (statusOf(statuses, dep) != StageStatus.DONE) {
                    satisfied = false;
                    break;
                }
            }
            if (satisfied) {
                ready.add(stage);
            }
        }
        return ready;
    }

    public List<StageDefinition> readyStages(PipelineTask task) {
        return readyStages(task.stageStatuses());
    }

    /**
     * PENDING stages that can never start because a dependency FAILED or was SKIPPED.
     */
    public List<StageDefinition> blockedStages(Map<String, StageStatus> statuses) {
        var blocked = new ArrayList<StageDefinition>();
        for (var stage : stages.values()) {
            if (statusOf(statuses, stage.name()) != StageStatus.PENDING) {
                continue;
            }
            for (var dep : stage.dependsOn()) {
                var depStatus = statusOf(statuses, dep);
                if (depStatus == StageStatus.FAILED || depStatus == StageStatus.SKIPPED) {
                    blocked.add(stage);
                    break;
                }
            }
        }
        return blocked;
    }

    /** True when no stage is PENDING or RUNNING. */
    public boolean isSettled(Map<String, StageStatus> statuses) {
        for (var name : stages.keySet()) {
            if (!statusOf(statuses, name).isSettled()) {
                return false;
            }
        }
        return true;
    }

    /** Progress fraction contributed by settled stages. */
    public double settledFraction(Map<String, StageStatus> statuses) {
        double settled = 0;
        for (var stage : stages.values()) {
            if (statusOf(statuses, stage.name()).isSettled()) {
                settled += stage.weight();
            }
        }
        return settled / totalWeight();
    }

    private static StageStatus statusOf(Map<String, StageStatus> statuses, String name) {
        return statuses.getOrDefault(name, StageStatus.PENDING);
    }

    private static List<String> sortTopologically(Map<String, StageDefinition> byName) {
        var inDegree = new HashMap<String, Integer>();
        var downstream = new HashMap<String, List<String>>();
        for (var stage : byName.values()) {
            inDegree.put(stage.name(), stage.dependsOn().size());
            for (var dep : stage.dependsOn()) {
                downstream.computeIfAbsent(dep, k -> new ArrayList<>()).add(stage.name());
            }
        }

        var queue = new ArrayDeque<String>();
        for (var name : byName.keySet()) {
            if (inDegree.get(name) == 0) {
                queue.add(name);
            }
        }

        var order = new ArrayList<String>();
        while (!queue.isEmpty()) {
            var name = queue.poll();
            order.add(name);
            for (var next : downstream.getOrDefault(name, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }

        if (order.size() != byName.size()) {
            var cyclic = new ArrayList<>(byName.keySet());
            cyclic.removeAll(order);
            throw new PipelineConfigurationException("Pipeline stages form a cycle: " + cyclic);
        }
        return order;
    }
}
