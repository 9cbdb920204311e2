package com.resumevault.exception;

import com.resumevault.ingestion.IngestionStage;
import lombok.Getter;

/**
 * Terminal ingestion failure after validation passed. Compensation has already run when this
 * reaches the caller.
 */
@Getter
public class IngestionException extends RuntimeException {

    public enum Category {
        STORAGE,
        DATABASE,
        UNEXPECTED
    }

    private final IngestionStage stage;
    private final Category category;
    private final String filename;

    public IngestionException(IngestionStage stage, Category category, String filename, Throwable cause) {
        super(cause.getMessage(), cause);
        this.stage = stage;
        this.category = category;
        this.filename = filename;
    }

    public String userMessage() {
        return switch (category) {
            case STORAGE -> String.format("Error storing the file for resume \"%s\". Please try again.", filename);
            case DATABASE -> String.format("Failed to save resume \"%s\" during step: %s.", filename, stage.label());
            case UNEXPECTED -> String.format("An unexpected error occurred while processing \"%s\" during step: %s.",
                filename, stage.label());
        };
    }
}
