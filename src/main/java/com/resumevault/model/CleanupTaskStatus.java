package com.resumevault.model;

public enum CleanupTaskStatus {
    PENDING,
    PROCESSING,
    DONE,
    FAILED
}
