package com.resumevault.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record Resume(
    UUID id,
    String name,
    String major,
    String graduationYear,
    UUID blobId,
    String uploadedBy,
    List<Tag> companies,
    List<Tag> keywords,
    boolean active,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public Resume withTags(List<Tag> companies, List<Tag> keywords) {
        return new Resume(id, name, major, graduationYear, blobId, uploadedBy,
            companies, keywords, active, createdAt, updatedAt);
    }

    public boolean isOwnedBy(String principalId) {
        return uploadedBy != null && uploadedBy.equals(principalId);
    }
}
