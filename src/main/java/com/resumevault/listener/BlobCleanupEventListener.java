package com.resumevault.listener;

import com.resumevault.cleanup.BlobCleanupService;
import com.resumevault.event.BlobCleanupRequestedEvent;
import com.resumevault.event.BlobCleanupRetryEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class BlobCleanupEventListener {

    private final BlobCleanupService cleanupService;

    @Async("blobCleanupExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleCleanupRequested(BlobCleanupRequestedEvent event) {
        log.info("Starting async blob cleanup for {} task(s)", event.taskIds().size());
        event.taskIds().forEach(cleanupService::process);
    }

    @Async("blobCleanupExecutor")
    @EventListener
    public void handleRetry(BlobCleanupRetryEvent event) {
        cleanupService.process(event.taskId());
    }
}
