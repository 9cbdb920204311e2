package com.resumevault.storage;

import com.resumevault.exception.BlobNotFoundException;
import com.resumevault.exception.StorageException;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.sql.PreparedStatement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Stores each blob as one {@code blob_files} row plus ordered fixed-size {@code blob_chunks}.
 * Every write runs in its own transaction so it never joins a caller's metadata transaction.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.blob", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcChunkedBlobStore implements BlobStore {

    private static final UUID FIRST_ID = new UUID(0L, 0L);

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate isolatedTx;
    private final int chunkSize;

    private final RowMapper<BlobDescriptor> descriptorRowMapper = (rs, rowNum) -> new BlobDescriptor(
        rs.getObject("id", UUID.class),
        rs.getString("filename"),
        rs.getString("content_type"),
        rs.getLong("length"),
        rs.getInt("chunk_size"),
        rs.getObject("uploaded_at", OffsetDateTime.class).toInstant()
    );

    public JdbcChunkedBlobStore(
        JdbcClient jdbcClient,
        JdbcTemplate jdbcTemplate,
        PlatformTransactionManager transactionManager,
        BlobStoreProperties properties
    ) {
        this.jdbcClient = jdbcClient;
        this.jdbcTemplate = jdbcTemplate;
        this.isolatedTx = new TransactionTemplate(transactionManager);
        this.isolatedTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.chunkSize = properties.chunkSize();
    }

    @Override
    public BlobDescriptor store(byte[] content, String filename, String contentType) {
        try {
            BlobDescriptor descriptor = isolatedTx.execute(status -> {
                BlobDescriptor saved = jdbcClient.sql("""
                        INSERT INTO blob_files (filename, content_type, length, chunk_size)
                        VALUES (:filename, :contentType, :length, :chunkSize)
                        RETURNING *
                        """)
                    .param("filename", filename)
                    .param("contentType", contentType)
                    .param("length", (long) content.length)
                    .param("chunkSize", chunkSize)
                    .query(descriptorRowMapper)
                    .single();

                saveChunks(saved.id(), content);
                return saved;
            });
            log.debug("Stored blob {} ({} bytes, {} chunks)", descriptor.id(), content.length,
                chunkCount(content.length, chunkSize));
            return descriptor;
        } catch (DataAccessException e) {
            throw new StorageException("File storage failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private void saveChunks(UUID blobId, byte[] content) {
        int chunks = chunkCount(content.length, chunkSize);
        if (chunks == 0) {
            return;
        }

        jdbcTemplate.batchUpdate("INSERT INTO blob_chunks (blob_id, n, data) VALUES (?, ?, ?)",
            new BatchPreparedStatementSetter() {
                @Override
                @SneakyThrows
                public void setValues(PreparedStatement ps, int i) {
                    int from = i * chunkSize;
                    int to = Math.min(content.length, from + chunkSize);
                    ps.setObject(1, blobId);
                    ps.setInt(2, i);
                    ps.setBytes(3, Arrays.copyOfRange(content, from, to));
                }

                @Override
                public int getBatchSize() {
                    return chunks;
                }
            });
    }

    @Override
    public BlobContent open(UUID blobId) {
        BlobDescriptor descriptor;
        try {
            descriptor = findDescriptor(blobId);
        } catch (DataAccessException e) {
            throw new StorageException("File lookup failed: " + e.getMostSpecificCause().getMessage(), e);
        }
        if (descriptor == null) {
            throw new BlobNotFoundException(blobId);
        }
        return new BlobContent(descriptor, new ChunkedInputStream(descriptor));
    }

    @Override
    public boolean delete(UUID blobId) {
        try {
            Integer removed = isolatedTx.execute(status -> jdbcClient.sql("DELETE FROM blob_files WHERE id = :id")
                .param("id", blobId)
                .update());
            boolean deleted = removed != null && removed > 0;
            if (deleted) {
                log.debug("Deleted blob {}", blobId);
            }
            return deleted;
        } catch (DataAccessException e) {
            throw new StorageException("File delete failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public boolean exists(UUID blobId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM blob_files WHERE id = :id")
            .param("id", blobId)
            .query(Long.class)
            .single() > 0;
    }

    @Override
    public List<BlobDescriptor> listStoredBefore(Instant cutoff, UUID afterId, int limit) {
        return jdbcClient.sql("""
                SELECT * FROM blob_files
                WHERE uploaded_at < :cutoff
                  AND id > :afterId
                ORDER BY id
                LIMIT :limit
                """)
            .param("cutoff", OffsetDateTime.ofInstant(cutoff, ZoneOffset.UTC))
            .param("afterId", afterId == null ? FIRST_ID : afterId)
            .param("limit", limit)
            .query(descriptorRowMapper)
            .list();
    }

    private BlobDescriptor findDescriptor(UUID blobId) {
        return jdbcClient.sql("SELECT * FROM blob_files WHERE id = :id")
            .param("id", blobId)
            .query(descriptorRowMapper)
            .optional()
            .orElse(null);
    }

    private byte[] readChunk(UUID blobId, int n) throws IOException {
        try {
            return jdbcClient.sql("SELECT data FROM blob_chunks WHERE blob_id = :id AND n = :n")
                .param("id", blobId)
                .param("n", n)
                .query((rs, rowNum) -> rs.getBytes("data"))
                .optional()
                .orElseThrow(() -> new IOException("Chunk " + n + " of blob " + blobId + " is missing"));
        } catch (DataAccessException e) {
            throw new IOException("Failed to read chunk " + n + " of blob " + blobId, e);
        }
    }

    static int chunkCount(long length, int chunkSize) {
        return (int) ((length + chunkSize - 1) / chunkSize);
    }

    /**
     * Pulls one chunk at a time; a chunk that disappears mid-read surfaces as an {@link IOException}.
     */
    private class ChunkedInputStream extends InputStream {

        private final BlobDescriptor descriptor;
        private final int totalChunks;
        private int nextChunk;
        private byte[] current = new byte[0];
        private int position;

        ChunkedInputStream(BlobDescriptor descriptor) {
            this.descriptor = descriptor;
            this.totalChunks = chunkCount(descriptor.length(), descriptor.chunkSize());
        }

        @Override
        public int read() throws IOException {
            if (!ensureAvailable()) {
                return -1;
            }
            return current[position++] & 0xFF;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            if (!ensureAvailable()) {
                return -1;
            }
            int count = Math.min(length, current.length - position);
            System.arraycopy(current, position, buffer, offset, count);
            position += count;
            return count;
        }

        private boolean ensureAvailable() throws IOException {
            while (position >= current.length) {
                if (nextChunk >= totalChunks) {
                    return false;
                }
                current = readChunk(descriptor.id(), nextChunk++);
                position = 0;
            }
            return true;
        }
    }
}
