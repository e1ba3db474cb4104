package me.golemcore.artifactor.domain.section;

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

import me.golemcore.artifactor.domain.model.analysis.ApiEndpoints;
import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.DependencyGraph;
import me.golemcore.artifactor.domain.model.analysis.EntityType;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.LanguageInfo;
import me.golemcore.artifactor.domain.model.analysis.ModuleNarrative;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deterministic markdown used when no model produces a section.
 */
final class SectionTemplates {

    private static final int MAX_ROWS = 40;
    private static final int MAX_DIAGRAM_EDGES = 25;

    private SectionTemplates() {
    }

    static String render(IntelligenceModel model, String sectionName) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(SectionCatalog.title(sectionName)).append("\n\n");
        out.append(summary(model)).append("\n\n");

        switch (sectionName) {
        case "features" -> {
            out.append("## Feature Areas\n\n");
            appendFeatureTable(out, model);
        }
        case "system_overview" -> {
            appendLanguages(out, model);
            out.append("## Architecture Diagram\n\n");
            appendDiagram(out, model);
        }
        case "api_specs" -> appendEndpoints(out, model);
        case "data_models" -> appendSchemas(out, model);
        case "security_considerations" -> {
            appendModules(out, model);
            out.append("## Coverage Summary\n\n")
                    .append("Analyzed ").append(model.llmAnalysis().chunksAnalyzed()).append(" code chunks and ")
                    .append(model.staticAnalysis().parsed().files().size()).append(" parsed files. ")
                    .append(model.validation().crossValidatedCount())
                    .append(" findings were confirmed by both analysis paths.\n");
        }
        default -> appendModules(out, model);
        }
        return out.toString();
    }

    private static String summary(IntelligenceModel model) {
        int files = model.languages().totalFiles();
        String primary = model.languages().primaryLanguage();
        return "This codebase contains " + files + " source files"
                + (primary != null ? ", written mainly in " + primary : "") + ", with "
                + model.staticAnalysis().parsed().entities().size() + " classes and functions identified by static"
                + " analysis and " + model.llmAnalysis().narratives().size() + " module descriptions.";
    }

    private static void appendLanguages(StringBuilder out, IntelligenceModel model) {
        out.append("## Languages\n\n| Language | Files | Lines |\n| --- | --- | --- |\n");
        for (LanguageInfo language : model.languages().languages()) {
            out.append("| ").append(language.name()).append(" | ").append(language.fileCount()).append(" | ")
                    .append(language.lineCount()).append(" |\n");
        }
        out.append('\n');
    }

    private static void appendFeatureTable(StringBuilder out, IntelligenceModel model) {
        Map<String, List<String>> functionsByFile = new TreeMap<>();
        for (CodeEntity entity : model.staticAnalysis().parsed().entities()) {
            if (entity.type() == EntityType.FUNCTION) {
                functionsByFile.computeIfAbsent(entity.filePath(), key -> new ArrayList<>()).add(entity.name());
            }
        }
        out.append("| File | Purpose | Functions |\n| --- | --- | --- |\n");
        int rows = 0;
        for (Map.Entry<String, List<String>> entry : functionsByFile.entrySet()) {
            if (rows++ >= MAX_ROWS) {
                break;
            }
            out.append("| `").append(entry.getKey()).append("` | ").append(purposeOf(model, entry.getKey()))
                    .append(" | ").append(entry.getValue().size()).append(" |\n");
        }
        out.append('\n');
    }

    private static void appendModules(StringBuilder out, IntelligenceModel model) {
        out.append("## Modules\n\n");
        int rows = 0;
        for (ModuleNarrative narrative : model.llmAnalysis().narratives()) {
            if (!narrative.isAvailable()) {
                continue;
            }
            if (rows++ >= MAX_ROWS) {
                break;
            }
            out.append("- `").append(narrative.filePath()).append("`: ").append(narrative.purpose()).append('\n');
        }
        if (rows == 0) {
            out.append("No module descriptions are available.\n");
        }
        out.append('\n');
    }

    private static void appendEndpoints(StringBuilder out, IntelligenceModel model) {
        out.append("## Endpoints\n\n| Method | Path | Location |\n| --- | --- | --- |\n");
        int rows = 0;
        for (ApiEndpoints.Endpoint endpoint : model.staticAnalysis().endpoints().endpoints()) {
            if (rows++ >= MAX_ROWS) {
                break;
            }
            out.append("| ").append(endpoint.method()).append(" | `").append(endpoint.path()).append("` | `")
                    .append(endpoint.filePath()).append(':').append(endpoint.line()).append("` |\n");
        }
        out.append('\n');
    }

    private static void appendSchemas(StringBuilder out, IntelligenceModel model) {
        int rows = 0;
        for (SchemaMap.Schema schema : model.staticAnalysis().schemas().schemas()) {
            if (rows++ >= MAX_ROWS) {
                break;
            }
            out.append("## ").append(schema.name()).append("\n\nDefined in `").append(schema.filePath()).append(':')
                    .append(schema.line()).append("`.\n\n| Field |\n| --- |\n");
            for (String field : schema.fields()) {
                out.append("| ").append(field).append(" |\n");
            }
            out.append('\n');
        }
        if (rows == 0) {
            out.append("No data structures were detected.\n");
        }
    }

    private static void appendDiagram(StringBuilder out, IntelligenceModel model) {
        out.append("```mermaid\ngraph LR\n");
        Set<String> lines = new LinkedHashSet<>();
        for (DependencyGraph.Edge edge : model.staticAnalysis().dependencyGraph().edges()) {
            if (edge.internal() && lines.size() < MAX_DIAGRAM_EDGES) {
                lines.add("    " + nodeId(edge.sourceFile()) + " --> " + nodeId(edge.target()));
            }
        }
        lines.forEach(line -> out.append(line).append('\n'));
        out.append("```\n");
    }

    private static String purposeOf(IntelligenceModel model, String filePath) {
        return model.llmAnalysis().narratives().stream()
                .filter(narrative -> narrative.isAvailable() && narrative.filePath().equals(filePath))
                .map(ModuleNarrative::purpose)
                .findFirst()
                .orElse("-");
    }

    private static String nodeId(String path) {
        return path.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
