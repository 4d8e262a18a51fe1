package com.docweaver.core.model;

import java.io.Serializable;

/**
 * Per-task generation settings.
 *
 * @param templateKind      document template
 * @param maxSections       upper bound on fan-out units per stage (outline sections)
 * @param concurrencyBudget maximum units of this task in flight at once
 * @param includeImages     whether the optional image stage runs
 * @param imageStyle        style passed to the image role
 */
public record GenerationConfig(
    TemplateKind templateKind,
    int maxSections,
    int concurrencyBudget,
    boolean includeImages,
    ImageStyle imageStyle
) implements Serializable {
}
