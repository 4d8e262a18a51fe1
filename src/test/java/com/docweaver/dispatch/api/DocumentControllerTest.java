package com.docweaver.dispatch.api;

import com.docweaver.core.engine.GenerationRequestValidator;
import com.docweaver.core.engine.PipelineOrchestrator;
import com.docweaver.core.engine.ValidationException;
import com.docweaver.core.events.PipelineEvent;
import com.docweaver.core.graph.DocumentPipeline;
import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.ImageStyle;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.TemplateKind;
import com.docweaver.core.state.InMemoryTaskStateStore;
import com.docweaver.core.state.TaskFailed;
import com.docweaver.core.state.TaskNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DocumentController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class DocumentControllerTest {

    private static final GenerationRequest REQUEST = new GenerationRequest("solar sails",
            new GenerationConfig(TemplateKind.ACADEMIC, 6, 3, true, ImageStyle.DIAGRAM));

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PipelineOrchestrator orchestrator;

    @MockitoBean
    private GenerationRequestValidator validator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private final InMemoryTaskStateStore store = new InMemoryTaskStateStore(DocumentPipeline.createDefault());

    // ── POST /api/v1/documents ───────────────────────────────────────

    @Test
    @DisplayName("POST /documents returns 202 Accepted with task_id")
    void submitDocument() throws Exception {
        when(validator.build(eq("solar sails"), eq("academic"), eq(6), isNull(), isNull(), isNull()))
                .thenReturn(REQUEST);
        when(orchestrator.submit(REQUEST)).thenReturn("DOC-2026-1a2b3c4d");

        mockMvc.perform(post("/api/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"solar sails","template":"academic","max_sections":6}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.task_id").value("DOC-2026-1a2b3c4d"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("POST /documents passes include_images and image_style through")
    void submitDocumentWithImageOptions() throws Exception {
        when(validator.build(any(), any(), any(), any(), any(), any())).thenReturn(REQUEST);
        when(orchestrator.submit(REQUEST)).thenReturn("DOC-2026-00000001");

        mockMvc.perform(post("/api/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"solar sails","concurrency":2,"include_images":false,"image_style":"realistic"}
                                """))
                .andExpect(status().isAccepted());

        var includeImages = ArgumentCaptor.forClass(Boolean.class);
        verify(validator).build(eq("solar sails"), isNull(), isNull(), eq(2), includeImages.capture(),
                eq("realistic"));
        assertEquals(Boolean.FALSE, includeImages.getValue());
    }

    @Test
    @DisplayName("POST /documents with invalid fields returns 400 listing every violation")
    void submitDocumentInvalid() throws Exception {
        when(validator.build(any(), any(), any(), any(), any(), any())).thenThrow(new ValidationException(List.of(
                "topic is required", "max_sections must be between 1 and 50")));

        mockMvc.perform(post("/api/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"","max_sections":0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid request"))
                .andExpect(jsonPath("$.violations", hasSize(2)))
                .andExpect(jsonPath("$.violations[0]", containsString("topic")));

        verify(orchestrator, never()).submit(any(GenerationRequest.class));
    }

    // ── GET /api/v1/documents ────────────────────────────────────────

    @Test
    @DisplayName("GET /documents lists tasks with their stages")
    void listDocuments() throws Exception {
        PipelineTask task = store.create(REQUEST);
        when(orchestrator.list()).thenReturn(List.of(task));

        mockMvc.perform(get("/api/v1/documents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].task_id").value(task.id()))
                .andExpect(jsonPath("$[0].template").value("academic"))
                .andExpect(jsonPath("$[0].stages.research.status").value("PENDING"))
                .andExpect(jsonPath("$[0].stages.image.required").value(false));
    }

    @Test
    @DisplayName("GET /documents/{id} returns the task snapshot")
    void getDocument() throws Exception {
        PipelineTask task = store.create(REQUEST);
        when(orchestrator.status(task.id())).thenReturn(task);

        mockMvc.perform(get("/api/v1/documents/" + task.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topic").value("solar sails"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.progress").value(0.0))
                .andExpect(jsonPath("$.image_style").value("diagram"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.artifact").doesNotExist());
    }

    @Test
    @DisplayName("GET /documents/{id} returns 404 for unknown task")
    void getDocumentNotFound() throws Exception {
        when(orchestrator.status("DOC-FAKE")).thenThrow(new TaskNotFoundException("DOC-FAKE"));

        mockMvc.perform(get("/api/v1/documents/DOC-FAKE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("DOC-FAKE")));
    }

    // ── POST /api/v1/documents/{id}/cancel ───────────────────────────

    @Test
    @DisplayName("POST /documents/{id}/cancel reports the resulting status")
    void cancelDocument() throws Exception {
        PipelineTask task = store.create(REQUEST);
        PipelineTask cancelled = store.apply(task.id(), new TaskFailed(TaskError.cancelled("cancelled by request")));
        when(orchestrator.cancel(task.id())).thenReturn(true);
        when(orchestrator.status(task.id())).thenReturn(cancelled);

        mockMvc.perform(post("/api/v1/documents/" + task.id() + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true))
                .andExpect(jsonPath("$.status").value("FAILED"));
    }

    @Test
    @DisplayName("POST /documents/{id}/cancel returns 404 for unknown task")
    void cancelNotFound() throws Exception {
        when(orchestrator.cancel("DOC-FAKE")).thenThrow(new TaskNotFoundException("DOC-FAKE"));

        mockMvc.perform(post("/api/v1/documents/DOC-FAKE/cancel"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/documents/{id}/events ────────────────────────────

    @Test
    @DisplayName("GET /documents/{id}/events streams a running task")
    void streamRunningTask() throws Exception {
        PipelineTask task = store.create(REQUEST);
        when(orchestrator.status(task.id())).thenReturn(task);
        when(sseStreamingService.createEmitter(task.id())).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/documents/" + task.id() + "/events"))
                .andExpect(request().asyncStarted());

        verify(sseStreamingService).createEmitter(task.id());
    }

    @Test
    @DisplayName("GET /documents/{id}/events replays the outcome of a finished task")
    void streamFinishedTask() throws Exception {
        PipelineTask task = store.create(REQUEST);
        PipelineTask failed = store.apply(task.id(), new TaskFailed(TaskError.cancelled("stop")));
        when(orchestrator.status(task.id())).thenReturn(failed);
        when(sseStreamingService.createCompletedEmitter(any())).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/documents/" + task.id() + "/events"));

        var event = ArgumentCaptor.forClass(PipelineEvent.class);
        verify(sseStreamingService).createCompletedEmitter(event.capture());
        verify(sseStreamingService, never()).createEmitter(anyString());
        assertEquals(PipelineEvent.TASK_FAILED, event.getValue().eventType());
    }

    @Test
    @DisplayName("GET /documents/{id}/events returns 404 for unknown task")
    void streamNotFound() throws Exception {
        when(orchestrator.status("DOC-FAKE")).thenThrow(new TaskNotFoundException("DOC-FAKE"));

        mockMvc.perform(get("/api/v1/documents/DOC-FAKE/events"))
                .andExpect(status().isNotFound());
    }
}
