package com.resumevault.ingestion;

import com.resumevault.security.ResumePrincipal;

/**
 * Upload plus optional caller-supplied fields. Tag lists arrive as comma-separated values.
 */
public record IngestionRequest(
    UploadedFile file,
    ResumePrincipal uploader,
    String name,
    String major,
    String graduationYear,
    String companies,
    String keywords
) {}
