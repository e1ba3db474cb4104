package me.golemcore.artifactor.domain.model.analysis;

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

/**
 * Deterministic findings of the static analysis stage. Each part falls back to
 * its own empty value independently.
 */
public record StaticAnalysisResult(
        ParsedSources parsed,
        CallGraph callGraph,
        DependencyGraph dependencyGraph,
        SchemaMap schemas,
        ApiEndpoints endpoints
) {

    public static StaticAnalysisResult empty() {
        return new StaticAnalysisResult(ParsedSources.empty(), CallGraph.empty(), DependencyGraph.empty(),
                SchemaMap.empty(), ApiEndpoints.empty());
    }
}
