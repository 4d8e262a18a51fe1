package com.docweaver.core.model;

import java.util.List;

/**
 * Document templates. Each carries the base section names handed to the structure agent.
 */
public enum TemplateKind {
    STANDARD(List.of(
            "Executive Summary", "Introduction", "Background", "Methodology",
            "Findings", "Analysis", "Conclusions", "Recommendations", "References")),
    ACADEMIC(List.of(
            "Abstract", "Introduction", "Literature Review", "Methodology",
            "Results", "Discussion", "Conclusion", "References")),
    BUSINESS(List.of(
            "Executive Summary", "Market Analysis", "Industry Trends", "Competitive Analysis",
            "Recommendations", "Implementation Plan", "References"));

    private final List<String> baseSections;

    TemplateKind(List<String> baseSections) {
        this.baseSections = baseSections;
    }

    public List<String> baseSections() {
        return baseSections;
    }
}
