package com.resumevault.controller;

import java.util.List;
import java.util.UUID;

/**
 * {@code parsingWarning} is serialized even when null so clients can tell a clean parse apart.
 */
public record UploadedResumeResponse(
    UUID id,
    String name,
    String major,
    String graduationYear,
    String parsingWarning,
    List<String> companies,
    List<String> keywords,
    String fileUrl
) {}
