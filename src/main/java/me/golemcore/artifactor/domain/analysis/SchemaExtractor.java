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

import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.EntityType;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds data shapes: classes whose body declares typed fields.
 */
@Component
public class SchemaExtractor implements StructureExtractor<SchemaMap> {

    private static final Pattern JVM_FIELD = Pattern.compile(
            "^\\s*(?:(?:private|protected|public|final|static)\\s+)+[\\w<>\\[\\],.? ]+\\s+(\\w+)\\s*(?:=[^;]*)?;");
    private static final Pattern ANNOTATED_FIELD = Pattern.compile(
            "^\\s+(\\w+)\\s*\\??\\s*:\\s*[\\w\\[\\]<>.,| \"']+(?:\\s*=.*)?;?\\s*$");
    private static final Pattern GO_FIELD = Pattern.compile("^\\s+([A-Z]\\w*)\\s+[\\w\\[\\]*.]+(?:\\s+`.*`)?\\s*$");

    private static final Map<String, Pattern> FIELD_PATTERNS = Map.of(
            "java", JVM_FIELD,
            "c_sharp", JVM_FIELD,
            "python", ANNOTATED_FIELD,
            "typescript", ANNOTATED_FIELD,
            "rust", ANNOTATED_FIELD,
            "go", GO_FIELD);

    @Override
    public String getName() {
        return "schemas";
    }

    @Override
    public SchemaMap extract(ParsedSources sources) {
        List<SchemaMap.Schema> schemas = new ArrayList<>();
        for (ParsedFile file : sources.files()) {
            Pattern fieldPattern = FIELD_PATTERNS.get(file.language());
            if (fieldPattern == null) {
                continue;
            }
            for (CodeEntity entity : file.entities()) {
                if (entity.type() != EntityType.CLASS) {
                    continue;
                }
                Set<String> fields = new LinkedHashSet<>();
                int last = Math.min(entity.endLine(), file.lines().size());
                for (int line = entity.startLine() + 1; line <= last; line++) {
                    Matcher matcher = fieldPattern.matcher(file.lines().get(line - 1));
                    if (matcher.find()) {
                        fields.add(matcher.group(1));
                    }
                }
                if (!fields.isEmpty()) {
                    schemas.add(new SchemaMap.Schema(entity.name(), file.filePath(), entity.startLine(),
                            List.copyOf(fields)));
                }
            }
        }
        return new SchemaMap(schemas);
    }

    @Override
    public SchemaMap emptyResult() {
        return SchemaMap.empty();
    }
}
