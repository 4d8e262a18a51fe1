package com.docweaver.dispatch.api;

import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageState;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.UnitTelemetry;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON response for document task endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
    @JsonProperty("task_id") String taskId,
    String topic,
    String status,
    double progress,
    String template,
    @JsonProperty("max_sections") int maxSections,
    @JsonProperty("include_images") boolean includeImages,
    @JsonProperty("image_style") String imageStyle,
    Map<String, StageResponse> stages,
    ErrorResponse error,
    @JsonProperty("artifact") String artifactHandle,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StageResponse(
        String status,
        boolean required,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        ErrorResponse error,
        @JsonProperty("skip_reason") String skipReason,
        @JsonProperty("failed_units") List<String> failedUnits,
        List<UnitResponse> units
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UnitResponse(
        @JsonProperty("unit_id") String unitId,
        String outcome,
        int attempts,
        @JsonProperty("backoff_ms") List<Long> backoffMs,
        @JsonProperty("elapsed_ms") long elapsedMs,
        ErrorResponse error
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        String stage,
        String kind,
        String message,
        @JsonProperty("unit_id") String unitId
    ) {}

    public static TaskResponse from(PipelineTask task) {
        var stages = new LinkedHashMap<String, StageResponse>();
        task.stages().forEach((name, state) -> stages.put(name, toStage(state)));
        var config = task.config();
        return new TaskResponse(
                task.id(),
                task.topic(),
                task.status().name(),
                task.progress(),
                config.templateKind().name().toLowerCase(Locale.ROOT),
                config.maxSections(),
                config.includeImages(),
                config.imageStyle().wireName(),
                stages,
                toError(task.error()),
                task.artifactHandle(),
                task.createdAt(),
                task.updatedAt());
    }

    private static StageResponse toStage(StageState state) {
        return new StageResponse(
                state.status().name(),
                state.required(),
                state.startedAt(),
                state.finishedAt(),
                toError(state.error()),
                state.skipReason(),
                state.failedUnits().isEmpty() ? null : state.failedUnits(),
                state.units().isEmpty() ? null : state.units().stream().map(TaskResponse::toUnit).toList());
    }

    private static UnitResponse toUnit(UnitTelemetry unit) {
        return new UnitResponse(unit.unitId(), unit.outcome() != null ? unit.outcome().name() : null,
                unit.attempts(), unit.backoffDelaysMs(), unit.elapsedMs(), toError(unit.error()));
    }

    private static ErrorResponse toError(TaskError error) {
        if (error == null) {
            return null;
        }
        return new ErrorResponse(error.stage(), error.kind() != null ? error.kind().name() : null,
                error.message(), error.unitId());
    }
}
