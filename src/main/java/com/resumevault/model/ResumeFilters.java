package com.resumevault.model;

import java.util.List;

public record ResumeFilters(
    List<String> majors,
    List<String> graduationYears,
    List<String> companies,
    List<String> keywords
) {}
