package com.resumevault.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class BlobNotFoundException extends RuntimeException {
    private final UUID blobId;

    public BlobNotFoundException(UUID blobId) {
        super("File not found: " + blobId);
        this.blobId = blobId;
    }
}
