package me.golemcore.artifactor.domain.pipeline;

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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.analysis.ChunkedFiles;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.domain.model.analysis.LlmAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.QualityReport;
import me.golemcore.artifactor.domain.model.analysis.SectionOutput;
import me.golemcore.artifactor.domain.model.analysis.StaticAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ValidationResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state shared by the stages of one run.
 *
 * <p>
 * Each stage writes its own fields and reads those of earlier stages. Stages
 * running in parallel write disjoint fields; sections are collected in a
 * synchronized list.
 */
@Getter
public class PipelineContext {

    private final String projectId;
    private final String traceId;
    private final Path sourcePath;
    private final List<String> sectionNames;
    private final ProgressListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<SectionOutput> sections = Collections.synchronizedList(new ArrayList<>());

    @Setter
    private volatile Path sourceRoot;
    @Setter
    private volatile LanguageMap languages = LanguageMap.empty();
    @Setter
    private volatile ChunkedFiles chunks = ChunkedFiles.empty();
    @Setter
    private volatile StaticAnalysisResult staticAnalysis = StaticAnalysisResult.empty();
    @Setter
    private volatile LlmAnalysisResult llmAnalysis = LlmAnalysisResult.empty();
    @Setter
    private volatile ValidationResult validation = ValidationResult.empty();
    @Setter
    private volatile IntelligenceModel intelligenceModel;
    @Setter
    private volatile QualityReport qualityReport;

    public PipelineContext(String projectId, String traceId, Path sourcePath, List<String> sectionNames,
            ProgressListener listener) {
        this.projectId = projectId;
        this.traceId = traceId;
        this.sourcePath = sourcePath;
        this.sectionNames = List.copyOf(sectionNames);
        this.listener = listener != null ? listener : ProgressListener.NONE;
    }

    public void report(StageEvent event) {
        listener.onEvent(event);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException
     *             if the run was cancelled
     */
    public void checkCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Analysis cancelled: " + projectId);
        }
    }

    public void addSection(SectionOutput section) {
        sections.add(section);
    }

    public List<SectionOutput> sectionsSnapshot() {
        synchronized (sections) {
            return List.copyOf(sections);
        }
    }
}
