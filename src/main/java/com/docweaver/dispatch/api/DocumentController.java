package com.docweaver.dispatch.api;

import com.docweaver.core.engine.GenerationRequestValidator;
import com.docweaver.core.engine.PipelineOrchestrator;
import com.docweaver.core.engine.ValidationException;
import com.docweaver.core.events.PipelineEvent;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.TaskStatus;
import com.docweaver.core.state.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for document generation tasks.
 */
@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final PipelineOrchestrator orchestrator;
    private final GenerationRequestValidator validator;
    private final SseStreamingService sseStreamingService;

    public DocumentController(PipelineOrchestrator orchestrator,
                              GenerationRequestValidator validator,
                              SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.validator = validator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/documents: submit a generation request. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody DocumentRequest request) {
        var generationRequest = validator.build(request.topic(), request.template(), request.maxSections(),
                request.concurrency(), request.includeImages(), request.imageStyle());
        String taskId = orchestrator.submit(generationRequest);
        log.info("Accepted document task {}", taskId);
        return ResponseEntity.accepted().body(Map.of(
                "task_id", taskId,
                "status", TaskStatus.PENDING.name()
        ));
    }

    /**
     * GET /api/v1/documents: list all tasks, newest first.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> list() {
        return ResponseEntity.ok(orchestrator.list().stream()
                .map(TaskResponse::from)
                .toList());
    }

    /**
     * GET /api/v1/documents/{id}: current snapshot of a task.
     */
    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(TaskResponse.from(orchestrator.status(id)));
    }

    /**
     * POST /api/v1/documents/{id}/cancel: cancel a running task.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        boolean cancelled = orchestrator.cancel(id);
        PipelineTask task = orchestrator.status(id);
        return ResponseEntity.ok(Map.of(
                "task_id", id,
                "cancelled", cancelled,
                "status", task.status().name()
        ));
    }

    /**
     * GET /api/v1/documents/{id}/events: SSE stream of progress events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        PipelineTask task = orchestrator.status(id);
        if (task.isTerminal()) {
            String eventType = task.status() == TaskStatus.COMPLETED
                    ? PipelineEvent.TASK_COMPLETED : PipelineEvent.TASK_FAILED;
            Map<String, Object> payload = task.status() == TaskStatus.COMPLETED
                    ? Map.of("artifact", task.artifactHandle())
                    : Map.of("message", task.error() != null ? task.error().summary() : "");
            return ResponseEntity.ok(sseStreamingService.createCompletedEmitter(new PipelineEvent(
                    eventType, task.id(), null, task.status().name(), task.progress(), payload, Instant.now())));
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "error", "invalid request",
                "violations", e.violations()
        ));
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TaskNotFoundException e) {
        return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
    }
}
