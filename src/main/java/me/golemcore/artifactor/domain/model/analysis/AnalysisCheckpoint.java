package me.golemcore.artifactor.domain.model.analysis;

import java.time.Instant;

/**
 * Stored model analysis of one chunk, keyed by project and chunk hash.
 */
public record AnalysisCheckpoint(String projectId, String chunkHash, ModuleNarrative narrative, Instant createdAt) {
}
