package com.resumevault.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record BlobCleanupTask(
    UUID id,
    UUID blobId,
    UUID resumeId,
    CleanupTaskStatus status,
    int attempts,
    String lastError,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
