package com.resumevault.worker;

import com.resumevault.repository.ResumeRepository;
import com.resumevault.storage.BlobDescriptor;
import com.resumevault.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Reclaims blobs that no active resume references. Covers uploads whose metadata commit never
 * happened (process crash between blob write and commit) and soft-deleted resumes whose cleanup
 * task ran out of attempts. Blobs younger than the grace period are never touched, since their
 * upload may still be in flight.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OrphanBlobSweepWorker {

    private final BlobStore blobStore;
    private final ResumeRepository resumeRepository;
    private final Clock clock;
    private final Duration gracePeriod;
    private final int batchSize;

    public OrphanBlobSweepWorker(
        BlobStore blobStore,
        ResumeRepository resumeRepository,
        Clock clock,
        @Value("${app.sweep.grace-period-minutes:60}") long gracePeriodMinutes,
        @Value("${app.sweep.batch-size:500}") int batchSize
    ) {
        this.blobStore = blobStore;
        this.resumeRepository = resumeRepository;
        this.clock = clock;
        this.gracePeriod = Duration.ofMinutes(gracePeriodMinutes);
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${app.sweep.interval-ms:3600000}",
        initialDelayString = "${app.sweep.interval-ms:3600000}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(gracePeriod);
        log.debug("Sweeping blobs stored before {}", cutoff);

        int scanned = 0;
        int reclaimed = 0;
        UUID cursor = null;
        while (true) {
            List<BlobDescriptor> page = blobStore.listStoredBefore(cutoff, cursor, batchSize);
            if (page.isEmpty()) {
                break;
            }
            scanned += page.size();

            Set<UUID> referenced = resumeRepository.findBlobIdsReferencedByActive(
                page.stream().map(BlobDescriptor::id).toList());

            for (BlobDescriptor blob : page) {
                if (referenced.contains(blob.id())) {
                    continue;
                }
                try {
                    if (blobStore.delete(blob.id())) {
                        reclaimed++;
                        log.info("Reclaimed orphan blob {} ({}, stored {})", blob.id(), blob.filename(),
                            blob.uploadedAt());
                    }
                } catch (RuntimeException e) {
                    log.warn("Could not reclaim orphan blob {}: {}", blob.id(), e.getMessage(), e);
                }
            }

            if (page.size() < batchSize) {
                break;
            }
            cursor = page.get(page.size() - 1).id();
        }

        if (reclaimed > 0) {
            log.info("Orphan sweep reclaimed {} of {} scanned blobs", reclaimed, scanned);
        }
    }
}
