package me.golemcore.artifactor.adapter.outbound.store;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.model.RunResult;
import me.golemcore.artifactor.port.outbound.AnalysisStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest run result per project. Disabled with
 * {@code artifactor.store.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "artifactor.store", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class InMemoryAnalysisStoreAdapter implements AnalysisStorePort {

    private final Map<String, RunResult> latest = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> save(RunResult result) {
        latest.put(result.projectId(), result);
        log.debug("[Store] Saved run of project {} with {} sections", result.projectId(), result.sections().size());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Optional<RunResult> findLatest(String projectId) {
        return Optional.ofNullable(latest.get(projectId));
    }
}
