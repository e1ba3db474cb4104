package me.golemcore.artifactor.domain.model.analysis;

/**
 * Declaration found in a source file. Lines are 1-based and inclusive.
 */
public record CodeEntity(String name, EntityType type, String filePath, int startLine, int endLine) {
}
