package com.resumevault.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumevault.exception.BlobNotFoundException;
import com.resumevault.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Keeps every blob as {@code <id>.bin} with a JSON descriptor in {@code <id>.json} next to it.
 * The data file is moved into place last, so a blob is only visible once it is complete.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.blob", name = "store", havingValue = "filesystem")
public class FileSystemBlobStore implements BlobStore {

    private static final String DATA_SUFFIX = ".bin";
    private static final String DESCRIPTOR_SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemBlobStore(BlobStoreProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.filesystem() != null && properties.filesystem().directory() != null
            ? properties.filesystem().directory()
            : "./blobs"), objectMapper);
    }

    FileSystemBlobStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public BlobDescriptor store(byte[] content, String filename, String contentType) {
        UUID id = UUID.randomUUID();
        // single segment per blob, so no chunk size
        BlobDescriptor descriptor = new BlobDescriptor(id, filename, contentType, content.length, 0, Instant.now());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, id.toString(), ".tmp");
            Files.write(temp, content);
            objectMapper.writeValue(descriptorPath(id).toFile(), descriptor);
            Files.move(temp, dataPath(id), StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored blob {} at {} ({} bytes)", id, dataPath(id), content.length);
            return descriptor;
        } catch (IOException e) {
            cleanupPartialWrite(id, temp);
            throw new StorageException("File storage failed: " + e.getMessage(), e);
        }
    }

    private void cleanupPartialWrite(UUID id, Path temp) {
        try {
            if (temp != null) {
                Files.deleteIfExists(temp);
            }
            Files.deleteIfExists(descriptorPath(id));
        } catch (IOException e) {
            log.warn("Could not remove partial write of blob {}: {}", id, e.getMessage());
        }
    }

    @Override
    public BlobContent open(UUID blobId) {
        Path data = dataPath(blobId);
        if (!Files.exists(data)) {
            throw new BlobNotFoundException(blobId);
        }
        try {
            BlobDescriptor descriptor = readDescriptor(blobId);
            InputStream stream = Files.newInputStream(data);
            return new BlobContent(descriptor, stream);
        } catch (NoSuchFileException e) {
            throw new BlobNotFoundException(blobId);
        } catch (IOException e) {
            throw new StorageException("File read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(UUID blobId) {
        try {
            boolean deleted = Files.deleteIfExists(dataPath(blobId));
            Files.deleteIfExists(descriptorPath(blobId));
            if (deleted) {
                log.debug("Deleted blob {}", blobId);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageException("File delete failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(UUID blobId) {
        return Files.exists(dataPath(blobId));
    }

    @Override
    public List<BlobDescriptor> listStoredBefore(Instant cutoff, UUID afterId, int limit) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(path -> path.getFileName().toString().endsWith(DESCRIPTOR_SUFFIX))
                .map(this::readDescriptorQuietly)
                .filter(Objects::nonNull)
                .filter(descriptor -> descriptor.uploadedAt().isBefore(cutoff))
                .filter(descriptor -> afterId == null || descriptor.id().compareTo(afterId) > 0)
                .sorted(Comparator.comparing(BlobDescriptor::id))
                .limit(limit)
                .toList();
        } catch (IOException e) {
            throw new StorageException("File listing failed: " + e.getMessage(), e);
        }
    }

    private BlobDescriptor readDescriptor(UUID blobId) throws IOException {
        try (InputStream in = Files.newInputStream(descriptorPath(blobId))) {
            return objectMapper.readValue(in, BlobDescriptor.class);
        }
    }

    private BlobDescriptor readDescriptorQuietly(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return objectMapper.readValue(in, BlobDescriptor.class);
        } catch (IOException e) {
            log.warn("Skipping unreadable blob descriptor {}: {}", path, e.getMessage());
            return null;
        }
    }

    private Path dataPath(UUID blobId) {
        return directory.resolve(blobId + DATA_SUFFIX);
    }

    private Path descriptorPath(UUID blobId) {
        return directory.resolve(blobId + DESCRIPTOR_SUFFIX);
    }
}
