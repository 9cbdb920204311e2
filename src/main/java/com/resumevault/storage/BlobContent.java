package com.resumevault.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * An opened blob. The caller owns the stream and must close it.
 */
public record BlobContent(BlobDescriptor descriptor, InputStream stream) implements AutoCloseable {

    public long transferTo(OutputStream out) throws IOException {
        return stream.transferTo(out);
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
