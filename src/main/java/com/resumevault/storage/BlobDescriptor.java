package com.resumevault.storage;

import java.time.Instant;
import java.util.UUID;

public record BlobDescriptor(
    UUID id,
    String filename,
    String contentType,
    long length,
    int chunkSize,
    Instant uploadedAt
) {}
