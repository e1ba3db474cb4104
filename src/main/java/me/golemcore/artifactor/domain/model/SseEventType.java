package me.golemcore.artifactor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SseEventType {
    STAGE, COMPLETE, ERROR, PAUSED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != STAGE;
    }
}
