package me.golemcore.artifactor.adapter.outbound.checkpoint;

import me.golemcore.artifactor.domain.model.analysis.AnalysisCheckpoint;
import me.golemcore.artifactor.port.outbound.CheckpointPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chunk checkpoints keyed by project and content hash, kept for the life of
 * the process.
 */
@Component
public class InMemoryCheckpointAdapter implements CheckpointPort {

    private final Map<String, Map<String, AnalysisCheckpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<AnalysisCheckpoint>> get(String projectId, String chunkHash) {
        Map<String, AnalysisCheckpoint> byHash = checkpoints.get(projectId);
        return CompletableFuture.completedFuture(Optional.ofNullable(byHash != null ? byHash.get(chunkHash) : null));
    }

    @Override
    public CompletableFuture<Void> put(AnalysisCheckpoint checkpoint) {
        checkpoints.computeIfAbsent(checkpoint.projectId(), key -> new ConcurrentHashMap<>())
                .put(checkpoint.chunkHash(), checkpoint);
        return CompletableFuture.completedFuture(null);
    }
}
