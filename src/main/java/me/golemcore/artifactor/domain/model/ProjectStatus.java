package me.golemcore.artifactor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a project.
 */
public enum ProjectStatus {
    PENDING, ANALYZING, ANALYZED, ERROR, PAUSED;

    /**
     * Statuses from which a new analysis may start.
     */
    public static final Set<ProjectStatus> STARTABLE = EnumSet.of(PENDING, ERROR, ANALYZED, PAUSED);

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
