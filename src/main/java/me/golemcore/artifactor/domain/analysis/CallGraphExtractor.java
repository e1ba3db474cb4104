package me.golemcore.artifactor.domain.analysis;

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

import me.golemcore.artifactor.domain.model.analysis.CallGraph;
import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.EntityType;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links functions to the project functions they call by name.
 */
@Component
public class CallGraphExtractor implements StructureExtractor<CallGraph> {

    private static final Pattern CALL = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    @Override
    public String getName() {
        return "call_graph";
    }

    @Override
    public CallGraph extract(ParsedSources sources) {
        Set<String> known = new HashSet<>();
        for (CodeEntity entity : sources.entities()) {
            if (entity.type() == EntityType.FUNCTION) {
                known.add(entity.name());
            }
        }

        List<CallGraph.Edge> edges = new ArrayList<>();
        for (ParsedFile file : sources.files()) {
            for (CodeEntity entity : file.entities()) {
                if (entity.type() != EntityType.FUNCTION) {
                    continue;
                }
                Set<String> seen = new LinkedHashSet<>();
                // the declaration line itself is skipped
                int last = Math.min(entity.endLine(), file.lines().size());
                for (int line = entity.startLine() + 1; line <= last; line++) {
                    Matcher matcher = CALL.matcher(file.lines().get(line - 1));
                    while (matcher.find()) {
                        String callee = matcher.group(1);
                        if (known.contains(callee) && seen.add(callee)) {
                            edges.add(new CallGraph.Edge(entity.name(), callee, file.filePath(), line));
                        }
                    }
                }
            }
        }
        return new CallGraph(edges);
    }

    @Override
    public CallGraph emptyResult() {
        return CallGraph.empty();
    }
}
