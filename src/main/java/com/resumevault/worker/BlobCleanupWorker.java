package com.resumevault.worker;

import com.resumevault.event.BlobCleanupRetryEvent;
import com.resumevault.repository.BlobCleanupTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class BlobCleanupWorker {

    private final BlobCleanupTaskRepository taskRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${app.cleanup.max-attempts:5}")
    private int maxAttempts;

    @Value("${app.cleanup.stale-threshold-minutes:5}")
    private int staleThresholdMinutes;

    @Scheduled(fixedDelayString = "${app.cleanup.retry-interval-ms:60000}")
    public void retryCleanups() {
        log.debug("Checking for failed or stale blob cleanups...");

        List<UUID> taskIds = taskRepository.resetStaleAndFailed(maxAttempts, staleThresholdMinutes);

        if (!taskIds.isEmpty()) {
            log.info("Resetting {} blob cleanup tasks for retry", taskIds.size());
            taskIds.forEach(id -> eventPublisher.publishEvent(new BlobCleanupRetryEvent(id)));
        }
    }
}
