package me.golemcore.artifactor.domain.pipeline;

import me.golemcore.artifactor.domain.model.StageStatus;

/**
 * Value produced by a stage together with its terminal status. For a failed
 * stage the value is the stage's default.
 */
public record StageResult<T>(T value, StageStatus status) {

    public boolean ok() {
        return status.ok();
    }

    public String stageName() {
        return status.name();
    }
}
