package com.resumevault.controller;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ResumeDetail(
    UUID id,
    String name,
    String major,
    String graduationYear,
    String fileUrl,
    List<String> companies,
    List<String> keywords,
    Uploader uploader,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public record Uploader(String id) {}
}
