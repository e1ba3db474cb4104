package me.golemcore.artifactor.domain.model.analysis;

import me.golemcore.artifactor.domain.model.ConfidenceScore;

/**
 * Finding after cross-validation. {@code filePath} is empty for model-only
 * findings.
 */
public record ValidatedEntity(String name, String type, String filePath, int line, ConfidenceScore score) {
}
