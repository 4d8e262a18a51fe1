package com.docweaver.core.graph;

import com.docweaver.core.gateway.AgentRole;
import com.docweaver.core.model.GenerationConfig;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Static declaration of one pipeline stage. Shared by every task; runtime state lives
 * in the task snapshot.
 *
 * @param name       unique stage name
 * @param role       agent role every unit of this stage invokes
 * @param dependsOn  stages that must be DONE before this one may start
 * @param required   whether a failure of this stage fails the task
 * @param weight     share of task progress this stage represents
 * @param planner    derives the fan-out units
 * @param merger     combines unit results into the draft
 * @param enabledWhen stages disabled for a task's config are skipped at task start
 */
public record StageDefinition(
    String name,
    AgentRole role,
    Set<String> dependsOn,
    boolean required,
    double weight,
    UnitPlanner planner,
    StageMerger merger,
    Predicate<GenerationConfig> enabledWhen
) {

    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(planner, "planner");
        Objects.requireNonNull(merger, "merger");
        dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        enabledWhen = enabledWhen == null ? config -> true : enabledWhen;
    }

    public boolean isEnabledFor(GenerationConfig config) {
        return enabledWhen.test(config);
    }

    public static Builder builder(String name, AgentRole role) {
        return new Builder(name, role);
    }

    public static final class Builder {
        private final String name;
        private final AgentRole role;
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private boolean required = true;
        private double weight = 1.0;
        private UnitPlanner planner;
        private StageMerger merger;
        private Predicate<GenerationConfig> enabledWhen;

        private Builder(String name, AgentRole role) {
            this.name = name;
            this.role = role;
        }

        public Builder dependsOn(String... stages) {
            dependsOn.addAll(List.of(stages));
            return this;
        }

        public Builder optional() {
            this.required = false;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder planner(UnitPlanner planner) {
            this.planner = planner;
            return this;
        }

        public Builder merger(StageMerger merger) {
            this.merger = merger;
            return this;
        }

        public Builder enabledWhen(Predicate<GenerationConfig> enabledWhen) {
            this.enabledWhen = enabledWhen;
            return this;
        }

        public StageDefinition build() {
            return new StageDefinition(name, role, dependsOn, required, weight, planner, merger, enabledWhen);
        }
    }
}
