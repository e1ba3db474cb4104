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
import me.golemcore.artifactor.domain.model.analysis.ApiEndpoints;
import me.golemcore.artifactor.domain.model.analysis.CallGraph;
import me.golemcore.artifactor.domain.model.analysis.DependencyGraph;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;
import me.golemcore.artifactor.domain.model.analysis.StaticAnalysisResult;
import me.golemcore.artifactor.domain.pipeline.PipelineExecutors;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Deterministic half of the dual analysis. Files are parsed on the parsing
 * pool, then the four structure extractors fan out on the same pool. The
 * calling stage thread only waits, so it never competes with its own work for
 * a stage slot. An extractor that throws contributes its empty result and the
 * others are unaffected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaticAnalyzer {

    private final SourceAccessPort sourceAccess;
    private final SourceParser sourceParser;
    private final StructureExtractor<CallGraph> callGraphExtractor;
    private final StructureExtractor<DependencyGraph> dependencyGraphExtractor;
    private final StructureExtractor<SchemaMap> schemaExtractor;
    private final StructureExtractor<ApiEndpoints> apiEndpointExtractor;
    private final PipelineExecutors executors;

    public StaticAnalysisResult analyze(Path root, LanguageMap languages) {
        ParsedSources parsed = parse(root, languages);

        CompletableFuture<CallGraph> callGraph = extractAsync(callGraphExtractor, parsed);
        CompletableFuture<DependencyGraph> dependencies = extractAsync(dependencyGraphExtractor, parsed);
        CompletableFuture<SchemaMap> schemas = extractAsync(schemaExtractor, parsed);
        CompletableFuture<ApiEndpoints> endpoints = extractAsync(apiEndpointExtractor, parsed);
        CompletableFuture.allOf(callGraph, dependencies, schemas, endpoints).join();

        StaticAnalysisResult result = new StaticAnalysisResult(parsed, callGraph.join(), dependencies.join(),
                schemas.join(), endpoints.join());
        log.info("[Static] Parsed {} files: {} entities, {} call edges, {} endpoints", parsed.files().size(),
                parsed.entities().size(), result.callGraph().edges().size(),
                result.endpoints().endpoints().size());
        return result;
    }

    ParsedSources parse(Path root, LanguageMap languages) {
        List<CompletableFuture<ParsedFile>> futures = new ArrayList<>();
        for (String file : sourceAccess.listFiles(root)) {
            Optional<String> language = LanguageDetector.languageOf(file);
            if (language.isEmpty() || !languages.contains(language.get())) {
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> parseFile(root, file, language.get()),
                    executors.parse()));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw e.getCause() instanceof RuntimeException runtime ? runtime : e;
        }
        List<ParsedFile> files = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();
        return new ParsedSources(files);
    }

    private ParsedFile parseFile(Path root, String file, String language) {
        try {
            return sourceParser.parse(file, language, sourceAccess.readLines(root, file));
        } catch (UncheckedIOException e) {
            log.debug("[Static] Skipping unreadable file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private <T> CompletableFuture<T> extractAsync(StructureExtractor<T> extractor, ParsedSources parsed) {
        return CompletableFuture.supplyAsync(() -> extract(extractor, parsed), executors.parse());
    }

    static <T> T extract(StructureExtractor<T> extractor, ParsedSources parsed) {
        try {
            return extractor.extract(parsed);
        } catch (RuntimeException e) {
            log.warn("[Static] Extractor {} failed, using empty result: {}", extractor.getName(), e.getMessage());
            return extractor.emptyResult();
        }
    }
}
