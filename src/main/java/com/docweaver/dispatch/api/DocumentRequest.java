package com.docweaver.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/documents.
 *
 * @param topic         what the document is about
 * @param template      standard, academic or business; nullable, defaults to standard
 * @param maxSections   upper bound on outline sections; nullable, defaults from config
 * @param concurrency   per-task concurrency budget; nullable, defaults from config
 * @param includeImages whether to generate section images; nullable, defaults to true
 * @param imageStyle    image style; nullable, defaults from config
 */
public record DocumentRequest(
    String topic,
    String template,
    @JsonProperty("max_sections") Integer maxSections,
    Integer concurrency,
    @JsonProperty("include_images") Boolean includeImages,
    @JsonProperty("image_style") String imageStyle
) {}
