package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.PipelineTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Default store. Tasks live in a {@link ConcurrentHashMap}; {@link #apply} runs inside
 * {@link ConcurrentMap#compute}, which serializes writers per id. State is lost on restart.
 */
public class InMemoryTaskStateStore implements TaskStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStateStore.class);

    private final ConcurrentMap<String, PipelineTask> tasks = new ConcurrentHashMap<>();
    private final PipelineGraph graph;
    private final Clock clock;

    public InMemoryTaskStateStore(PipelineGraph graph) {
        this(graph, Clock.systemUTC());
    }

    public InMemoryTaskStateStore(PipelineGraph graph, Clock clock) {
        this.graph = graph;
        this.clock = clock;
    }

    @Override
    public PipelineTask create(GenerationRequest request) {
        Instant now = clock.instant();
        while (true) {
            String id = TaskTransitions.nextTaskId(now);
            PipelineTask task = TaskTransitions.newTask(id, request, graph, now);
            if (tasks.putIfAbsent(id, task) == null) {
                log.debug("Created task {} for topic '{}'", id, request.topic());
                return task;
            }
        }
    }

    @Override
    public Optional<PipelineTask> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<PipelineTask> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(PipelineTask::createdAt).reversed()
                        .thenComparing(PipelineTask::id))
                .toList();
    }

    /** Everything in memory was created by this process. */
    @Override
    public List<PipelineTask> listOwnedUnfinished() {
        return tasks.values().stream()
                .filter(task -> !task.isTerminal())
                .sorted(Comparator.comparing(PipelineTask::createdAt).thenComparing(PipelineTask::id))
                .toList();
    }

    @Override
    public PipelineTask apply(String taskId, TaskTransition transition) {
        PipelineTask updated = tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.isTerminal()) {
                log.debug("Ignoring {} on terminal task {} ({})", transition.describe(), id, current.status());
                return current;
            }
            return TaskTransitions.apply(current, transition, graph, clock.instant());
        });
        if (updated == null) {
            throw new TaskNotFoundException(taskId);
        }
        return updated;
    }
}
