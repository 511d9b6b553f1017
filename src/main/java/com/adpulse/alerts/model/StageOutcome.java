package com.adpulse.alerts.model;

import com.adpulse.alerts.exception.AlertEngineException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Result of one pipeline stage: either a value or the engine error that prevented it.
 * Lets the orchestrator count failures without relying on exceptions crossing stage boundaries.
 */
public final class StageOutcome<T> {

    private final T value;
    private final AlertEngineException failure;

    private StageOutcome(T value, AlertEngineException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> StageOutcome<T> success(T value) {
        return new StageOutcome<>(value, null);
    }

    public static <T> StageOutcome<T> failure(AlertEngineException failure) {
        return new StageOutcome<>(null, failure);
    }

    /**
     * Run the stage, capturing engine errors. Anything else propagates.
     */
    public static <T> StageOutcome<T> of(Supplier<T> stage) {
        try {
            return success(stage.get());
        } catch (AlertEngineException e) {
            return failure(e);
        }
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Stage failed: " + failure.getMessage(), failure);
        }
        return value;
    }

    public Optional<AlertEngineException> getFailure() {
        return Optional.ofNullable(failure);
    }
}
