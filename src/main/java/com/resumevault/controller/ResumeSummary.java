package com.resumevault.controller;

import java.util.List;
import java.util.UUID;

public record ResumeSummary(
    UUID id,
    String name,
    String major,
    String graduationYear,
    String fileUrl,
    List<String> companies,
    List<String> keywords
) {}
