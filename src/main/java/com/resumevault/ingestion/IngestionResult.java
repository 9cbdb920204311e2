package com.resumevault.ingestion;

import com.resumevault.model.Resume;

/**
 * @param parsingWarning extractor failure message, {@code null} when extraction succeeded
 */
public record IngestionResult(Resume resume, String originalFilename, String parsingWarning) {}
