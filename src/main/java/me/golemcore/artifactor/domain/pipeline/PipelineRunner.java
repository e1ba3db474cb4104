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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.ArtifactorConstants;
import me.golemcore.artifactor.domain.analysis.CodeChunker;
import me.golemcore.artifactor.domain.analysis.CrossValidator;
import me.golemcore.artifactor.domain.analysis.LanguageDetector;
import me.golemcore.artifactor.domain.analysis.LlmChunkAnalyzer;
import me.golemcore.artifactor.domain.analysis.StaticAnalyzer;
import me.golemcore.artifactor.domain.exception.StageFailedException;
import me.golemcore.artifactor.domain.model.Citation;
import me.golemcore.artifactor.domain.model.GuardrailResult;
import me.golemcore.artifactor.domain.model.RunResult;
import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.StageStatus;
import me.golemcore.artifactor.domain.model.TraceCategory;
import me.golemcore.artifactor.domain.model.analysis.ChunkedFiles;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.domain.model.analysis.LlmAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.QualityReport;
import me.golemcore.artifactor.domain.model.analysis.SectionOutput;
import me.golemcore.artifactor.domain.model.analysis.StaticAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ValidationResult;
import me.golemcore.artifactor.domain.section.SectionCatalog;
import me.golemcore.artifactor.domain.section.SectionGenerator;
import me.golemcore.artifactor.domain.service.GuardrailEvaluator;
import me.golemcore.artifactor.domain.service.TraceDispatcher;
import me.golemcore.artifactor.domain.trace.TraceEvents;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.AnalysisStorePort;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the analysis stage graph for one project.
 *
 * <p>
 * Order: resolve, detect, chunk, static and model analysis in parallel,
 * cross-validation, intelligence model, section generation in parallel,
 * citation verification and optional persistence. A failing stage is replaced
 * by its default and the run continues as partial; a failing foundational
 * stage (resolve, intelligence model) aborts the run. Cancellation is checked
 * between stages and surfaces as {@link java.util.concurrent.CancellationException}.
 *
 * <p>
 * Stage bodies only return values; the runner writes them into the
 * {@link PipelineContext}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineRunner {

    private final StageExecutor stageExecutor;
    private final LanguageDetector languageDetector;
    private final CodeChunker codeChunker;
    private final StaticAnalyzer staticAnalyzer;
    private final LlmChunkAnalyzer llmChunkAnalyzer;
    private final CrossValidator crossValidator;
    private final SectionGenerator sectionGenerator;
    private final GuardrailEvaluator guardrailEvaluator;
    private final SourceAccessPort sourceAccess;
    private final TraceDispatcher traceDispatcher;
    private final ObjectProvider<AnalysisStorePort> analysisStore;
    private final PipelineExecutors executors;
    private final ArtifactorProperties properties;
    private final Clock clock;

    public RunResult run(PipelineContext context) {
        long startNanos = System.nanoTime();
        List<StageStatus> statuses = new ArrayList<>();
        boolean success = false;
        traceDispatcher.emit(TraceEvents.pipelineStart(context.getTraceId(), Instant.now(clock),
                context.getProjectId()));
        log.info("[Pipeline] Starting analysis of project {} at {}", context.getProjectId(), context.getSourcePath());
        try {
            RunResult result = execute(context, statuses, startNanos);
            success = !result.aborted();
            return result;
        } finally {
            double durationMs = StageExecutor.elapsedMs(startNanos);
            traceDispatcher.emit(TraceEvents.pipelineEnd(context.getTraceId(), Instant.now(clock), durationMs,
                    success));
            log.info("[Pipeline] Project {} finished in {}ms (success={})", context.getProjectId(),
                    Math.round(durationMs), success);
        }
    }

    private RunResult execute(PipelineContext context, List<StageStatus> statuses, long startNanos) {
        StageResult<Path> resolved = stageExecutor.run(resolveStage(), context);
        statuses.add(resolved.status());
        if (haltsRun(resolved)) {
            return aborted(context, statuses, startNanos, resolved.status().name());
        }
        context.setSourceRoot(resolved.value());
        context.checkCancelled();

        StageResult<LanguageMap> detected = stageExecutor.run(detectStage(), context);
        statuses.add(detected.status());
        context.setLanguages(detected.value());
        context.checkCancelled();

        StageResult<ChunkedFiles> chunked = stageExecutor.run(chunkStage(), context);
        statuses.add(chunked.status());
        context.setChunks(chunked.value());
        context.checkCancelled();

        runDualAnalysis(context, statuses);
        context.checkCancelled();

        StageResult<ValidationResult> validated = stageExecutor.run(qualityStage(), context);
        statuses.add(validated.status());
        context.setValidation(validated.value());
        context.checkCancelled();

        StageResult<IntelligenceModel> model = stageExecutor.run(intelligenceModelStage(), context);
        statuses.add(model.status());
        if (haltsRun(model)) {
            return aborted(context, statuses, startNanos, model.status().name());
        }
        context.setIntelligenceModel(model.value());
        context.checkCancelled();

        runSectionGeneration(context, statuses);
        context.checkCancelled();

        List<Citation> citations = context.sectionsSnapshot().stream()
                .flatMap(section -> section.citations().stream())
                .toList();
        if (!citations.isEmpty()) {
            StageResult<QualityReport> verified = stageExecutor.run(citationStage(citations), context);
            statuses.add(verified.status());
            context.setQualityReport(verified.value());
            context.checkCancelled();
        }

        AnalysisStorePort store = analysisStore.getIfAvailable();
        if (store != null) {
            RunResult snapshot = buildResult(context, statuses, false, startNanos);
            StageResult<Boolean> persisted = stageExecutor.run(persistenceStage(store, snapshot), context);
            statuses.add(persisted.status());
        }

        return buildResult(context, statuses, false, startNanos);
    }

    private void runDualAnalysis(PipelineContext context, List<StageStatus> statuses) {
        FunctionalStage<StaticAnalysisResult> staticStage = FunctionalStage.<StaticAnalysisResult>builder()
                .name(ArtifactorConstants.STAGE_STATIC_ANALYSIS)
                .category(TraceCategory.ANALYSIS)
                .body(ctx -> staticAnalyzer.analyze(ctx.getSourceRoot(), ctx.getLanguages()))
                .fallback(StaticAnalysisResult::empty)
                .summary(result -> "Parsed " + result.parsed().files().size() + " files, "
                        + result.parsed().entities().size() + " entities")
                .build();
        FunctionalStage<LlmAnalysisResult> llmStage = FunctionalStage.<LlmAnalysisResult>builder()
                .name(ArtifactorConstants.STAGE_LLM_ANALYSIS)
                .category(TraceCategory.LLM)
                .body(ctx -> llmChunkAnalyzer.analyze(ctx, ctx.getChunks().chunks()))
                .fallback(LlmAnalysisResult::empty)
                .description(ctx -> "Analyzing " + ctx.getChunks().chunks().size() + " code chunks")
                .summary(result -> "Analyzed " + result.chunksAnalyzed() + " code chunks ("
                        + result.checkpointHits() + " from checkpoints)")
                .build();

        ParallelStageGroup group = new ParallelStageGroup(ArtifactorConstants.STAGE_DUAL_ANALYSIS,
                List.of(staticStage, llmStage), 0, null);
        List<StageResult<?>> results = runGroup(group, context, "Running static and AI analysis");
        for (StageResult<?> result : results) {
            statuses.add(result.status());
            if (result.value() instanceof StaticAnalysisResult staticResult) {
                context.setStaticAnalysis(staticResult);
            } else if (result.value() instanceof LlmAnalysisResult llmResult) {
                context.setLlmAnalysis(llmResult);
            }
        }
    }

    private void runSectionGeneration(PipelineContext context, List<StageStatus> statuses) {
        List<FunctionalStage<SectionOutput>> stages = new ArrayList<>();
        for (String sectionName : context.getSectionNames()) {
            if (!SectionCatalog.isKnown(sectionName)) {
                log.warn("[Pipeline] Unknown section '{}', skipping", sectionName);
                continue;
            }
            stages.add(FunctionalStage.<SectionOutput>builder()
                    .name(ArtifactorConstants.SECTION_STAGE_PREFIX + sectionName)
                    .category(TraceCategory.GENERATION)
                    .body(ctx -> sectionGenerator.generate(ctx.getIntelligenceModel(), sectionName,
                            ctx.getTraceId()))
                    .summary(section -> String.format(Locale.ROOT, "Confidence %.2f", section.confidence()))
                    .build());
        }
        if (stages.isEmpty()) {
            return;
        }

        ArtifactorProperties.AnalysisProperties settings = properties.getAnalysis();
        ParallelStageGroup group = new ParallelStageGroup(ArtifactorConstants.STAGE_SECTION_GENERATION, stages,
                settings.getSectionMaxConcurrency(), settings.getSectionTimeout());
        List<StageResult<?>> results = runGroup(group, context, "Generating " + stages.size() + " sections");
        for (StageResult<?> result : results) {
            statuses.add(result.status());
            if (result.value() instanceof SectionOutput section) {
                context.addSection(section);
            } else {
                String sectionName = result.stageName().substring(ArtifactorConstants.SECTION_STAGE_PREFIX.length());
                log.warn("[Pipeline] Section {} failed, using placeholder: {}", sectionName, result.status().error());
                context.addSection(SectionOutput.degraded(sectionName, SectionCatalog.title(sectionName),
                        result.status().error()));
            }
        }
    }

    private List<StageResult<?>> runGroup(ParallelStageGroup group, PipelineContext context, String message) {
        long startNanos = System.nanoTime();
        context.report(StageEvent.running(group.getName(), message));
        List<StageResult<?>> results = group.execute(context, stageExecutor, executors.stage());
        long failed = results.stream().filter(result -> !result.ok()).count();
        context.report(StageEvent.done(group.getName(),
                (results.size() - failed) + "/" + results.size() + " stages succeeded",
                StageExecutor.elapsedMs(startNanos)));
        return results;
    }

    private PipelineStage<Path> resolveStage() {
        return FunctionalStage.<Path>builder()
                .name(ArtifactorConstants.STAGE_INGESTION_RESOLVE)
                .body(ctx -> {
                    Path root = ctx.getSourcePath().toAbsolutePath().normalize();
                    if (!sourceAccess.isDirectory(root)) {
                        throw new StageFailedException(ArtifactorConstants.STAGE_INGESTION_RESOLVE,
                                "Source path is not a directory: " + root);
                    }
                    return root;
                })
                .description(ctx -> "Resolving " + ctx.getSourcePath())
                .summary(Path::toString)
                .build();
    }

    private PipelineStage<LanguageMap> detectStage() {
        return FunctionalStage.<LanguageMap>builder()
                .name(ArtifactorConstants.STAGE_INGESTION_DETECT)
                .body(ctx -> languageDetector.detect(ctx.getSourceRoot()))
                .fallback(LanguageMap::empty)
                .summary(languages -> "Detected " + languages.languages().size() + " languages across "
                        + languages.totalFiles() + " files")
                .build();
    }

    private PipelineStage<ChunkedFiles> chunkStage() {
        return FunctionalStage.<ChunkedFiles>builder()
                .name(ArtifactorConstants.STAGE_INGESTION_CHUNK)
                .body(ctx -> codeChunker.chunk(ctx.getSourceRoot(), ctx.getLanguages()))
                .fallback(ChunkedFiles::empty)
                .summary(chunks -> "Created " + chunks.chunks().size() + " chunks from " + chunks.totalFiles()
                        + " files")
                .build();
    }

    private PipelineStage<ValidationResult> qualityStage() {
        return FunctionalStage.<ValidationResult>builder()
                .name(ArtifactorConstants.STAGE_QUALITY)
                .category(TraceCategory.QUALITY)
                .body(ctx -> crossValidator.validate(ctx.getStaticAnalysis(), ctx.getLlmAnalysis()))
                .fallback(ValidationResult::empty)
                .summary(result -> result.crossValidatedCount() + " cross-validated, " + result.astOnlyCount()
                        + " AST-only, " + result.llmOnlyCount() + " LLM-only")
                .build();
    }

    private PipelineStage<IntelligenceModel> intelligenceModelStage() {
        return FunctionalStage.<IntelligenceModel>builder()
                .name(ArtifactorConstants.STAGE_INTELLIGENCE_MODEL)
                .body(ctx -> {
                    if (ctx.getStaticAnalysis() == null || ctx.getLlmAnalysis() == null
                            || ctx.getValidation() == null) {
                        throw new StageFailedException(ArtifactorConstants.STAGE_INTELLIGENCE_MODEL,
                                "Analysis results are incomplete, cannot assemble the intelligence model");
                    }
                    return new IntelligenceModel(ctx.getProjectId(), ctx.getLanguages(), ctx.getStaticAnalysis(),
                            ctx.getLlmAnalysis(), ctx.getValidation(), Instant.now(clock));
                })
                .summary(model -> model.contextItemCount() + " context items")
                .build();
    }

    private PipelineStage<QualityReport> citationStage(List<Citation> citations) {
        return FunctionalStage.<QualityReport>builder()
                .name(ArtifactorConstants.STAGE_CITATION_VERIFICATION)
                .category(TraceCategory.QUALITY)
                .body(ctx -> {
                    List<GuardrailResult> results = guardrailEvaluator.verifyCitations(citations,
                            ctx.getSourceRoot());
                    int valid = (int) results.stream().filter(GuardrailResult::passed).count();
                    return new QualityReport(results, results.size(), valid,
                            averageConfidence(ctx.sectionsSnapshot()));
                })
                .summary(report -> String.format(Locale.ROOT, "%d/%d citations valid (%.0f%%)", report.citationsValid(),
                        report.citationsChecked(), report.citationAccuracy() * 100))
                .build();
    }

    private PipelineStage<Boolean> persistenceStage(AnalysisStorePort store, RunResult snapshot) {
        return FunctionalStage.<Boolean>builder()
                .name(ArtifactorConstants.STAGE_PERSISTENCE)
                .body(ctx -> {
                    store.save(snapshot).join();
                    return Boolean.TRUE;
                })
                .fallback(() -> Boolean.FALSE)
                .build();
    }

    private static boolean haltsRun(StageResult<?> result) {
        return ArtifactorConstants.isFoundational(result.status().name()) && (!result.ok() || result.value() == null);
    }

    private RunResult aborted(PipelineContext context, List<StageStatus> statuses, long startNanos, String stage) {
        log.error("[Pipeline] Foundational stage {} failed, aborting project {}", stage, context.getProjectId());
        return buildResult(context, statuses, true, startNanos);
    }

    private RunResult buildResult(PipelineContext context, List<StageStatus> statuses, boolean aborted,
            long startNanos) {
        boolean partial = aborted || statuses.stream().anyMatch(status -> !status.ok());
        return RunResult.builder()
                .projectId(context.getProjectId())
                .stages(statuses)
                .partial(partial)
                .aborted(aborted)
                .sections(orderSections(context.sectionsSnapshot(), context.getSectionNames()))
                .model(context.getIntelligenceModel())
                .qualityReport(context.getQualityReport())
                .totalDurationMs(StageExecutor.elapsedMs(startNanos))
                .build();
    }

    static List<SectionOutput> orderSections(List<SectionOutput> sections, List<String> order) {
        Map<String, Integer> positions = order.stream()
                .distinct()
                .collect(Collectors.toMap(Function.identity(), order::indexOf));
        return sections.stream()
                .sorted(Comparator.comparingInt(section -> positions.getOrDefault(section.sectionName(),
                        Integer.MAX_VALUE)))
                .toList();
    }

    static double averageConfidence(List<SectionOutput> sections) {
        return sections.stream()
                .mapToDouble(SectionOutput::confidence)
                .filter(confidence -> confidence > 0)
                .average()
                .orElse(0.0);
    }
}
