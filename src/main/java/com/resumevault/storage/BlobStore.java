package com.resumevault.storage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Binary object storage addressed by store-generated ids.
 * <p>
 * Writes are append-only: a stored blob is never modified, only deleted. The store owns its own
 * consistency and never takes part in a metadata-store transaction.
 */
public interface BlobStore {

    /**
     * Persist the bytes as a new blob.
     *
     * @param content     the bytes to store
     * @param filename    already sanitized filename kept as storage metadata
     * @param contentType MIME type kept as storage metadata
     * @return descriptor of the new blob, carrying its generated id
     * @throws com.resumevault.exception.StorageException if the write fails; nothing is visible afterwards
     */
    BlobDescriptor store(byte[] content, String filename, String contentType);

    /**
     * Open a blob for streaming. Lookup happens eagerly so a missing blob is reported before any byte
     * is handed out; the returned stream reads lazily.
     *
     * @throws com.resumevault.exception.BlobNotFoundException if no blob has this id
     */
    BlobContent open(UUID blobId);

    /**
     * Delete a blob. Deleting a blob that does not exist is not an error.
     *
     * @return {@code true} if a blob was removed
     * @throws com.resumevault.exception.StorageException if the store could not be reached
     */
    boolean delete(UUID blobId);

    boolean exists(UUID blobId);

    /**
     * One page of blobs stored strictly before the cutoff, ordered by id. Pass the last id of the
     * previous page as {@code afterId} to continue, or {@code null} to start.
     */
    List<BlobDescriptor> listStoredBefore(Instant cutoff, UUID afterId, int limit);
}
