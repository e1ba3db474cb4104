package me.golemcore.artifactor.domain.model;

public enum ConfidenceLevel {
    HIGH, MEDIUM, LOW
}
