package com.resumevault.event;

import java.util.UUID;

public record BlobCleanupRetryEvent(UUID taskId) {}
