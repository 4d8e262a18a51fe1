package com.docweaver.core.engine;

import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.ImageStyle;
import com.docweaver.core.model.TemplateKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Checks generation requests and builds them from loosely typed input (REST body, CLI
 * options), filling unset fields from the configured defaults.
 */
public class GenerationRequestValidator {

    public static final int MAX_TOPIC_LENGTH = 500;
    public static final int MAX_SECTIONS = 50;
    public static final int MAX_TASK_CONCURRENCY = 64;

    private final int defaultMaxSections;
    private final int defaultConcurrency;
    private final ImageStyle defaultImageStyle;

    public GenerationRequestValidator(int defaultMaxSections, int defaultConcurrency, ImageStyle defaultImageStyle) {
        this.defaultMaxSections = defaultMaxSections;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultImageStyle = defaultImageStyle;
    }

    /**
     * Builds a request, applying defaults for null fields.
     *
     * @throws ValidationException listing every problem found
     */
    public GenerationRequest build(String topic, String template, Integer maxSections, Integer concurrency,
                                   Boolean includeImages, String imageStyle) {
        var violations = new ArrayList<String>();

        TemplateKind templateKind = TemplateKind.STANDARD;
        if (template != null && !template.isBlank()) {
            try {
                templateKind = TemplateKind.valueOf(template.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                violations.add("template must be one of " + Arrays.toString(TemplateKind.values())
                        .toLowerCase(Locale.ROOT));
            }
        }

        ImageStyle style = defaultImageStyle;
        if (imageStyle != null && !imageStyle.isBlank()) {
            var parsed = ImageStyle.parse(imageStyle);
            if (parsed.isPresent()) {
                style = parsed.get();
            } else {
                violations.add("image_style must be one of " + Arrays.toString(ImageStyle.values())
                        .toLowerCase(Locale.ROOT));
            }
        }

        var config = new GenerationConfig(
                templateKind,
                maxSections != null ? maxSections : defaultMaxSections,
                concurrency != null ? concurrency : defaultConcurrency,
                includeImages == null || includeImages,
                style);
        var request = new GenerationRequest(topic == null ? null : topic.trim(), config);
        violations.addAll(check(request));
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return request;
    }

    /**
     * @throws ValidationException listing every problem found
     */
    public void validate(GenerationRequest request) {
        var violations = check(request);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private List<String> check(GenerationRequest request) {
        var violations = new ArrayList<String>();
        if (request == null) {
            violations.add("request is required");
            return violations;
        }
        String topic = request.topic();
        if (topic == null || topic.isBlank()) {
            violations.add("topic is required");
        } else if (topic.length() > MAX_TOPIC_LENGTH) {
            violations.add("topic must be at most " + MAX_TOPIC_LENGTH + " characters");
        }

        GenerationConfig config = request.config();
        if (config == null) {
            violations.add("config is required");
            return violations;
        }
        if (config.templateKind() == null) {
            violations.add("template is required");
        }
        if (config.maxSections() < 1 || config.maxSections() > MAX_SECTIONS) {
            violations.add("max_sections must be between 1 and " + MAX_SECTIONS);
        }
        if (config.concurrencyBudget() < 1 || config.concurrencyBudget() > MAX_TASK_CONCURRENCY) {
            violations.add("concurrency must be between 1 and " + MAX_TASK_CONCURRENCY);
        }
        if (config.imageStyle() == null) {
            violations.add("image_style is required");
        }
        return violations;
    }
}
