package com.resumevault.service;

import com.resumevault.storage.BlobContent;

import java.io.IOException;
import java.util.UUID;

/**
 * An opened resume binary ready to be written to a response.
 */
public record ResumeFile(UUID resumeId, String inlineFilename, BlobContent content) implements AutoCloseable {

    public long length() {
        return content.descriptor().length();
    }

    @Override
    public void close() throws IOException {
        content.close();
    }
}
