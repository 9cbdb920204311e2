package com.resumevault.ingestion;

import java.util.function.Consumer;

/**
 * One forward action of a {@link Saga} and the action that undoes it.
 *
 * @param <C> shared context the steps read from and write to
 */
public interface SagaStep<C> {

    IngestionStage stage();

    void execute(C context);

    /**
     * Undo a successful {@link #execute}. Only called for steps that completed.
     */
    default void compensate(C context) {
    }

    default boolean hasCompensation() {
        return false;
    }

    static <C> SagaStep<C> of(IngestionStage stage, Consumer<C> action) {
        return new SimpleStep<>(stage, action, null);
    }

    static <C> SagaStep<C> of(IngestionStage stage, Consumer<C> action, Consumer<C> compensation) {
        return new SimpleStep<>(stage, action, compensation);
    }

    record SimpleStep<C>(IngestionStage stage, Consumer<C> action, Consumer<C> compensation) implements SagaStep<C> {

        @Override
        public void execute(C context) {
            action.accept(context);
        }

        @Override
        public void compensate(C context) {
            if (compensation != null) {
                compensation.accept(context);
            }
        }

        @Override
        public boolean hasCompensation() {
            return compensation != null;
        }
    }
}
