package me.golemcore.artifactor.domain.model.analysis;

public enum EntityType {
    CLASS, FUNCTION
}
