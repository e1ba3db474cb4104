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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.model.analysis.LanguageInfo;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects source languages by file extension.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LanguageDetector {

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("py", "python"), Map.entry("pyi", "python"),
            Map.entry("js", "javascript"), Map.entry("mjs", "javascript"), Map.entry("cjs", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"), Map.entry("tsx", "typescript"),
            Map.entry("java", "java"), Map.entry("kt", "kotlin"),
            Map.entry("go", "go"), Map.entry("rs", "rust"),
            Map.entry("c", "c"), Map.entry("h", "c"),
            Map.entry("cpp", "cpp"), Map.entry("cc", "cpp"), Map.entry("hpp", "cpp"),
            Map.entry("cs", "c_sharp"), Map.entry("rb", "ruby"), Map.entry("php", "php"),
            Map.entry("sql", "sql"), Map.entry("json", "json"), Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"), Map.entry("toml", "toml"), Map.entry("md", "markdown"));

    /**
     * Languages whose chunks are worth model analysis. Data and markup files are
     * detected and chunked but not narrated.
     */
    public static final Set<String> ANALYZABLE_LANGUAGES = Set.of(
            "python", "javascript", "typescript", "java", "kotlin", "go", "rust", "c", "cpp", "c_sharp", "ruby",
            "php");

    private final SourceAccessPort sourceAccess;

    public static Optional<String> languageOf(String filePath) {
        int dot = filePath.lastIndexOf('.');
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        if (dot < 0 || dot < slash) {
            return Optional.empty();
        }
        String extension = filePath.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(EXTENSIONS.get(extension));
    }

    public LanguageMap detect(Path root) {
        Map<String, int[]> stats = new HashMap<>();
        Map<String, Set<String>> extensions = new HashMap<>();

        for (String file : sourceAccess.listFiles(root)) {
            Optional<String> language = languageOf(file);
            if (language.isEmpty()) {
                continue;
            }
            int lines;
            try {
                lines = sourceAccess.countLines(root, file);
            } catch (UncheckedIOException e) {
                log.debug("[Ingestion] Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            int[] counts = stats.computeIfAbsent(language.get(), key -> new int[2]);
            counts[0]++;
            counts[1] += lines;
            extensions.computeIfAbsent(language.get(), key -> new TreeSet<>())
                    .add(file.substring(file.lastIndexOf('.')).toLowerCase(Locale.ROOT));
        }

        List<LanguageInfo> languages = new ArrayList<>();
        for (Map.Entry<String, int[]> entry : stats.entrySet()) {
            languages.add(new LanguageInfo(entry.getKey(), entry.getValue()[0], entry.getValue()[1],
                    List.copyOf(extensions.get(entry.getKey()))));
        }
        languages.sort(Comparator.comparingInt(LanguageInfo::lineCount).reversed()
                .thenComparing(LanguageInfo::name));

        String primary = languages.isEmpty() ? null : languages.get(0).name();
        return new LanguageMap(languages, primary);
    }
}
