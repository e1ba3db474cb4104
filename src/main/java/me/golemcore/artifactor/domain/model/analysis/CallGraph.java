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

import java.util.List;

/**
 * Caller to callee edges between known functions.
 */
public record CallGraph(List<Edge> edges) {

    public record Edge(String caller, String callee, String filePath, int line) {
    }

    public CallGraph {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static CallGraph empty() {
        return new CallGraph(List.of());
    }
}
