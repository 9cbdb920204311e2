package com.resumevault.ingestion;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Runs steps in order. When a step throws, the completed steps are compensated in reverse order and
 * the failure is rethrown as a {@link SagaExecutionException}. Compensation failures are logged and
 * never replace the original failure.
 */
@Slf4j
public class Saga<C> {

    private final String name;
    private final List<SagaStep<C>> steps;

    public Saga(String name, List<SagaStep<C>> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public void run(C context) {
        Deque<SagaStep<C>> completed = new ArrayDeque<>();
        for (SagaStep<C> step : steps) {
            try {
                log.debug("[{}] Running step {}", name, step.stage().label());
                step.execute(context);
                completed.push(step);
            } catch (RuntimeException e) {
                log.error("[{}] Step {} failed: {}", name, step.stage().label(), e.getMessage());
                compensate(context, completed);
                throw new SagaExecutionException(step.stage(), e);
            }
        }
    }

    private void compensate(C context, Deque<SagaStep<C>> completed) {
        while (!completed.isEmpty()) {
            SagaStep<C> step = completed.pop();
            if (!step.hasCompensation()) {
                continue;
            }
            try {
                log.info("[{}] Compensating step {}", name, step.stage().label());
                step.compensate(context);
            } catch (RuntimeException e) {
                log.error("[{}] Compensation of step {} failed: {}", name, step.stage().label(), e.getMessage(), e);
            }
        }
    }
}
