package com.resumevault.event;

import java.util.List;
import java.util.UUID;

public record BlobCleanupRequestedEvent(List<UUID> taskIds) {

    public BlobCleanupRequestedEvent {
        taskIds = List.copyOf(taskIds);
    }
}
