package com.resumevault.ingestion;

public enum IngestionStage {
    VALIDATION("validation"),
    RESUME_PARSING("resume_parsing"),
    DATA_PROCESSING("data_processing"),
    BLOB_UPLOAD("blob_upload"),
    ASSOCIATE_COMPANIES("associate_companies"),
    ASSOCIATE_KEYWORDS("associate_keywords"),
    DATABASE_CREATE("database_create");

    private final String label;

    IngestionStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
