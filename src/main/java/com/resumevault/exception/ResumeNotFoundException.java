package com.resumevault.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ResumeNotFoundException extends RuntimeException {
    private final UUID resumeId;

    public ResumeNotFoundException(UUID resumeId) {
        super("Resume not found.");
        this.resumeId = resumeId;
    }

    public ResumeNotFoundException(String message) {
        super(message);
        this.resumeId = null;
    }
}
