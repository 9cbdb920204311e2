package com.resumevault.ingestion;

import lombok.Getter;

/**
 * A saga step failed; compensations of the earlier steps have already run.
 */
@Getter
public class SagaExecutionException extends RuntimeException {

    private final IngestionStage failedStage;

    public SagaExecutionException(IngestionStage failedStage, RuntimeException cause) {
        super("Step " + failedStage.label() + " failed: " + cause.getMessage(), cause);
        this.failedStage = failedStage;
    }

    @Override
    public synchronized RuntimeException getCause() {
        return (RuntimeException) super.getCause();
    }
}
