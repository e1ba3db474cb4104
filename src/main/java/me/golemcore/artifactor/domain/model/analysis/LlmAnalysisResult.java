package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

/**
 * Findings of the model analysis stage.
 */
public record LlmAnalysisResult(List<ModuleNarrative> narratives, int chunksAnalyzed, int checkpointHits,
        int failedChunks) {

    public LlmAnalysisResult {
        narratives = narratives == null ? List.of() : List.copyOf(narratives);
    }

    public static LlmAnalysisResult empty() {
        return new LlmAnalysisResult(List.of(), 0, 0, 0);
    }
}
