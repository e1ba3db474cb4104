package me.golemcore.artifactor.port.outbound;

import me.golemcore.artifactor.domain.model.RunResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Optional port for persisting completed run results.
 */
public interface AnalysisStorePort {

    CompletableFuture<Void> save(RunResult result);

    Optional<RunResult> findLatest(String projectId);
}
