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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * Structural view of one source file produced by a {@code SourceParser}.
 */
public record ParsedFile(
        String filePath,
        String language,
        @JsonIgnore List<String> lines,
        List<CodeEntity> entities,
        List<String> imports
) {

    public ParsedFile {
        lines = lines == null ? List.of() : List.copyOf(lines);
        entities = entities == null ? List.of() : List.copyOf(entities);
        imports = imports == null ? List.of() : List.copyOf(imports);
    }
}
