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
import me.golemcore.artifactor.domain.model.analysis.ChunkedFiles;
import me.golemcore.artifactor.domain.model.analysis.CodeChunk;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits source files into fixed-size line windows. A trailing window shorter
 * than the minimum is merged into the one before it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CodeChunker {

    private final SourceAccessPort sourceAccess;
    private final ArtifactorProperties properties;

    public ChunkedFiles chunk(Path root, LanguageMap languages) {
        int maxLines = Math.max(1, properties.getAnalysis().getMaxChunkLines());
        int minLines = Math.max(1, properties.getAnalysis().getMinChunkLines());

        List<CodeChunk> chunks = new ArrayList<>();
        int totalFiles = 0;
        int totalLines = 0;
        for (String file : sourceAccess.listFiles(root)) {
            Optional<String> language = LanguageDetector.languageOf(file);
            if (language.isEmpty() || !languages.contains(language.get())) {
                continue;
            }
            List<String> lines;
            try {
                lines = sourceAccess.readLines(root, file);
            } catch (UncheckedIOException e) {
                log.debug("[Ingestion] Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            if (lines.isEmpty()) {
                continue;
            }
            totalFiles++;
            totalLines += lines.size();
            chunks.addAll(split(file, language.get(), lines, maxLines, minLines));
        }
        return new ChunkedFiles(chunks, totalFiles, totalLines);
    }

    static List<CodeChunk> split(String file, String language, List<String> lines, int maxLines, int minLines) {
        List<int[]> ranges = new ArrayList<>();
        for (int start = 0; start < lines.size(); start += maxLines) {
            ranges.add(new int[] { start, Math.min(lines.size(), start + maxLines) });
        }
        if (ranges.size() > 1) {
            int[] last = ranges.get(ranges.size() - 1);
            if (last[1] - last[0] < minLines) {
                ranges.remove(ranges.size() - 1);
                ranges.get(ranges.size() - 1)[1] = last[1];
            }
        }

        List<CodeChunk> chunks = new ArrayList<>(ranges.size());
        for (int[] range : ranges) {
            String content = String.join("\n", lines.subList(range[0], range[1]));
            chunks.add(new CodeChunk(file, language, range[0] + 1, range[1], content));
        }
        return chunks;
    }
}
