package me.golemcore.artifactor.domain.service;

import java.util.concurrent.CompletableFuture;

/**
 * Captured result of a deduplicated operation: either a value or the error it
 * failed with. Every caller sharing the operation receives this same outcome.
 */
final class OperationOutcome {

    private final boolean success;
    private final Object value;
    private final Throwable error;

    private OperationOutcome(boolean success, Object value, Throwable error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    static OperationOutcome success(Object value) {
        return new OperationOutcome(true, value, null);
    }

    static OperationOutcome failure(Throwable error) {
        return new OperationOutcome(false, null, error);
    }

    boolean isSuccess() {
        return success;
    }

    Throwable error() {
        return error;
    }

    /**
     * Complete the target with this outcome. A captured
     * {@link java.util.concurrent.CancellationException} is delivered as-is, so
     * the target reports itself cancelled.
     */
    @SuppressWarnings("unchecked")
    <T> void deliverTo(CompletableFuture<T> target) {
        if (success) {
            target.complete((T) value);
        } else {
            target.completeExceptionally(error);
        }
    }
}
