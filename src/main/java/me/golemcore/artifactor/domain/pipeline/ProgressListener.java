package me.golemcore.artifactor.domain.pipeline;

import me.golemcore.artifactor.domain.model.StageEvent;

/**
 * Receives stage events synchronously, once per event, on the thread that
 * produced it. Implementations must be thread-safe: parallel stages report
 * concurrently.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> {
    };

    void onEvent(StageEvent event);
}
