package com.resumevault.model;

import java.util.List;
import java.util.UUID;

/**
 * Fully normalized field values of a resume that has not been committed yet.
 */
public record ResumeDraft(
    String name,
    String major,
    String graduationYear,
    List<String> companies,
    List<String> keywords
) {

    public ResumeDraft {
        companies = List.copyOf(companies);
        keywords = List.copyOf(keywords);
    }

    public Resume toResume(UUID blobId, String uploadedBy, List<Tag> resolvedCompanies, List<Tag> resolvedKeywords) {
        return new Resume(null, name, major, graduationYear, blobId, uploadedBy,
            resolvedCompanies, resolvedKeywords, true, null, null);
    }
}
