package com.resumevault.ingestion;

/**
 * Raw upload as received. {@code content} may be {@code null} when no file part was sent.
 */
public record UploadedFile(byte[] content, String originalFilename) {

    public long size() {
        return content == null ? 0 : content.length;
    }

    public String displayName() {
        return originalFilename == null || originalFilename.isBlank() ? "Unnamed file" : originalFilename;
    }
}
