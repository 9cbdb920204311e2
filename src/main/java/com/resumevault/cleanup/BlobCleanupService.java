package com.resumevault.cleanup;

import com.resumevault.model.BlobCleanupTask;
import com.resumevault.repository.BlobCleanupTaskRepository;
import com.resumevault.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Deletes the blob of a soft-deleted resume. Each attempt is recorded on the task row, so a failed
 * deletion stays visible and is picked up again by {@link com.resumevault.worker.BlobCleanupWorker}.
 */
@Slf4j
@Service
public class BlobCleanupService {

    private final BlobCleanupTaskRepository taskRepository;
    private final BlobStore blobStore;
    private final int maxAttempts;

    public BlobCleanupService(
        BlobCleanupTaskRepository taskRepository,
        BlobStore blobStore,
        @Value("${app.cleanup.max-attempts:5}") int maxAttempts
    ) {
        this.taskRepository = taskRepository;
        this.blobStore = blobStore;
        this.maxAttempts = maxAttempts;
    }

    public void process(UUID taskId) {
        Optional<BlobCleanupTask> claimed = taskRepository.claim(taskId, maxAttempts);
        if (claimed.isEmpty()) {
            log.debug("Cleanup task {} already claimed, finished or out of attempts", taskId);
            return;
        }

        BlobCleanupTask task = claimed.get();
        try {
            boolean existed = blobStore.delete(task.blobId());
            taskRepository.markDone(task.id());
            log.info("Blob {} of resume {} cleaned up (found: {}, attempt {})",
                task.blobId(), task.resumeId(), existed, task.attempts());
        } catch (RuntimeException e) {
            log.error("Failed to delete blob {} of resume {} (attempt {}/{}): {}",
                task.blobId(), task.resumeId(), task.attempts(), maxAttempts, e.getMessage(), e);
            taskRepository.markFailed(task.id(), e.getMessage());
        }
    }
}
