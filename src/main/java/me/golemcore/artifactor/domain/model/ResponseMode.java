package me.golemcore.artifactor.domain.model;

/**
 * Expected shape of a model reply.
 */
public enum ResponseMode {
    TEXT, JSON
}
