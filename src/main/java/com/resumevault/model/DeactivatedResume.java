package com.resumevault.model;

import java.util.UUID;

/**
 * A resume that was just flipped to inactive, with the blob it still points at.
 */
public record DeactivatedResume(UUID resumeId, UUID blobId) {}
