package com.resumevault.extraction;

import java.util.List;

/**
 * Extractor output. Scalar fields may be {@code null} when not found.
 */
public record ExtractedResume(
    String name,
    String major,
    String graduationYear,
    List<String> companies,
    List<String> keywords
) {

    public static final String UNSPECIFIED = "Unspecified";

    public ExtractedResume {
        companies = companies == null ? List.of() : List.copyOf(companies);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static ExtractedResume fallback(String fallbackName) {
        return new ExtractedResume(fallbackName, UNSPECIFIED, UNSPECIFIED, List.of(), List.of());
    }
}
