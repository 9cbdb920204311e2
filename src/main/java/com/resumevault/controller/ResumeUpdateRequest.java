package com.resumevault.controller;

import jakarta.validation.constraints.Size;

/**
 * Partial update. Blank fields keep the stored value; {@code companies} and {@code keywords} are
 * comma-separated and replace the current list when present.
 */
public record ResumeUpdateRequest(
    @Size(max = 255, message = "Name must be at most 255 characters")
    String name,

    @Size(max = 255, message = "Major must be at most 255 characters")
    String major,

    @Size(max = 255, message = "Graduation year must be at most 255 characters")
    String graduationYear,

    String companies,

    String keywords
) {}
