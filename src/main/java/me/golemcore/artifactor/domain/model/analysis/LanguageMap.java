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
 * Languages detected in a source tree, ordered by line count descending.
 */
public record LanguageMap(List<LanguageInfo> languages, String primaryLanguage) {

    public LanguageMap {
        languages = languages == null ? List.of() : List.copyOf(languages);
    }

    public static LanguageMap empty() {
        return new LanguageMap(List.of(), null);
    }

    public int totalFiles() {
        return languages.stream().mapToInt(LanguageInfo::fileCount).sum();
    }

    public boolean contains(String language) {
        return languages.stream().anyMatch(info -> info.name().equals(language));
    }
}
