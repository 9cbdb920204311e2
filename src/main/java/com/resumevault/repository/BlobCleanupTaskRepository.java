package com.resumevault.repository;

import com.resumevault.model.BlobCleanupTask;
import com.resumevault.model.DeactivatedResume;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BlobCleanupTaskRepository {
    List<UUID> enqueue(Collection<DeactivatedResume> deactivated);
    Optional<BlobCleanupTask> findById(UUID id);
    Optional<BlobCleanupTask> claim(UUID id, int maxAttempts);
    void markDone(UUID id);
    void markFailed(UUID id, String error);
    List<UUID> resetStaleAndFailed(int maxAttempts, int staleThresholdMinutes);
}
