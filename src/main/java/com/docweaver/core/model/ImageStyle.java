package com.docweaver.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Rendering styles accepted by the image role.
 */
public enum ImageStyle {
    ABSTRACT,
    REALISTIC,
    DIAGRAM,
    INFOGRAPHIC,
    ARTISTIC;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ImageStyle> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
