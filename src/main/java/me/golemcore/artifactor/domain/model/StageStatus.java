package me.golemcore.artifactor.domain.model;

/**
 * Terminal record of one stage of a run. {@code error} is null for
 * successful stages.
 */
public record StageStatus(String name, boolean ok, double durationMs, String error) {

    public static StageStatus ok(String name, double durationMs) {
        return new StageStatus(name, true, durationMs, null);
    }

    public static StageStatus failed(String name, double durationMs, String error) {
        return new StageStatus(name, false, durationMs, error);
    }
}
