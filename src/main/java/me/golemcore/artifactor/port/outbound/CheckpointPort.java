package me.golemcore.artifactor.port.outbound;

import me.golemcore.artifactor.domain.model.analysis.AnalysisCheckpoint;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for chunk-level analysis checkpoints, so a resumed run skips chunks that
 * were already analyzed.
 */
public interface CheckpointPort {

    CompletableFuture<Optional<AnalysisCheckpoint>> get(String projectId, String chunkHash);

    CompletableFuture<Void> put(AnalysisCheckpoint checkpoint);
}
