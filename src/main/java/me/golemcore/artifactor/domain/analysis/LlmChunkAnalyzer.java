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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.ArtifactorConstants;
import me.golemcore.artifactor.domain.exception.GuardrailViolationException;
import me.golemcore.artifactor.domain.model.ConfidenceLevel;
import me.golemcore.artifactor.domain.model.ModelCallOutcome;
import me.golemcore.artifactor.domain.model.ModelMessage;
import me.golemcore.artifactor.domain.model.ModelRequest;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.analysis.AnalysisCheckpoint;
import me.golemcore.artifactor.domain.model.analysis.CodeChunk;
import me.golemcore.artifactor.domain.model.analysis.LlmAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ModuleNarrative;
import me.golemcore.artifactor.domain.pipeline.PipelineContext;
import me.golemcore.artifactor.domain.resilience.ResilientModelCaller;
import me.golemcore.artifactor.domain.service.GuardrailEvaluator;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.CheckpointPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Model half of the dual analysis. Each analyzable chunk is looked up in the
 * checkpoint store and otherwise sent through the model fallback chain; at most
 * {@code llm-max-concurrency} chunks are in flight. When the overall deadline
 * passes, the narratives gathered so far are returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmChunkAnalyzer {

    private static final long POLL_MILLIS = 200;

    private static final String SYSTEM_PROMPT = """
            You are a senior engineer documenting an unfamiliar codebase.
            Describe what the given code does for its users, not how it is written.
            Respond with a single JSON object and nothing else:
            {"purpose": "<one sentence>", "behaviors": ["<observable behavior>", ...], \
            "confidence": "high|medium|low"}""";

    private final ResilientModelCaller modelCaller;
    private final CheckpointPort checkpointPort;
    private final GuardrailEvaluator guardrailEvaluator;
    private final ArtifactorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LlmAnalysisResult analyze(PipelineContext context, List<CodeChunk> chunks) {
        List<CodeChunk> analyzable = chunks.stream()
                .filter(chunk -> LanguageDetector.ANALYZABLE_LANGUAGES.contains(chunk.language()))
                .toList();
        int total = analyzable.size();
        if (total == 0) {
            return LlmAnalysisResult.empty();
        }

        ArtifactorProperties.AnalysisProperties settings = properties.getAnalysis();
        Semaphore permits = new Semaphore(Math.max(1, settings.getLlmMaxConcurrency()));
        int progressEvery = Math.max(1, settings.getProgressEvery());
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger checkpointHits = new AtomicInteger();
        long deadline = System.nanoTime() + settings.getLlmTimeout().toNanos();

        List<CompletableFuture<ModuleNarrative>> futures = new ArrayList<>(total);
        for (CodeChunk chunk : analyzable) {
            context.checkCancelled();
            if (!acquire(permits, deadline, context)) {
                log.warn("[LLM] Analysis deadline reached after launching {}/{} chunks", futures.size(), total);
                break;
            }
            CompletableFuture<ModuleNarrative> future = analyzeChunk(context, chunk, checkpointHits)
                    .whenComplete((narrative, error) -> {
                        permits.release();
                        int done = completed.incrementAndGet();
                        if (done % progressEvery == 0 || done == total) {
                            context.report(StageEvent.progress(ArtifactorConstants.STAGE_LLM_ANALYSIS,
                                    "Analyzed " + done + "/" + total + " code chunks", done, total));
                        }
                    });
            futures.add(future);
        }

        awaitUntil(futures, deadline, settings.getLlmTimeout(), context);

        List<ModuleNarrative> narratives = new ArrayList<>();
        for (CompletableFuture<ModuleNarrative> future : futures) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                narratives.add(future.join());
            }
        }
        int failed = (int) narratives.stream().filter(narrative -> !narrative.isAvailable()).count();
        long degraded = narratives.stream().filter(narrative -> narrative.confidence() == ConfidenceLevel.LOW).count();
        if (degraded > 0) {
            log.warn("[LLM] {} of {} narratives have low confidence", degraded, narratives.size());
        }
        log.info("[LLM] Analyzed {}/{} chunks ({} from checkpoints, {} failed)", narratives.size(), total,
                checkpointHits.get(), failed);
        return new LlmAnalysisResult(narratives, narratives.size(), checkpointHits.get(), failed);
    }

    private CompletableFuture<ModuleNarrative> analyzeChunk(PipelineContext context, CodeChunk chunk,
            AtomicInteger checkpointHits) {
        String hash = chunk.hash();
        return checkpointPort.get(context.getProjectId(), hash)
                .handle((checkpoint, error) -> {
                    if (error != null) {
                        log.debug("[LLM] Checkpoint lookup failed for {}: {}", chunk.filePath(), error.getMessage());
                        return Optional.<AnalysisCheckpoint>empty();
                    }
                    return checkpoint;
                })
                .thenCompose(checkpoint -> {
                    if (checkpoint.isPresent()) {
                        checkpointHits.incrementAndGet();
                        return CompletableFuture.completedFuture(checkpoint.get().narrative());
                    }
                    return callModel(context, chunk)
                            .thenApply(narrative -> store(context, hash, narrative));
                })
                .exceptionally(error -> {
                    log.warn("[LLM] Chunk {}:{} could not be analyzed: {}", chunk.filePath(), chunk.startLine(),
                            error.getMessage());
                    return ModuleNarrative.unavailable(chunk.filePath());
                });
    }

    private CompletableFuture<ModuleNarrative> callModel(PipelineContext context, CodeChunk chunk) {
        String code;
        try {
            code = guardrailEvaluator.validateInput(chunk.content());
        } catch (GuardrailViolationException e) {
            return CompletableFuture.completedFuture(ModuleNarrative.unavailable(chunk.filePath()));
        }
        ModelRequest request = ModelRequest.builder()
                .purpose("chunk_analysis")
                .traceId(context.getTraceId())
                .messages(List.of(
                        ModelMessage.system(SYSTEM_PROMPT),
                        ModelMessage.user(buildPrompt(chunk, code))))
                .timeout(properties.getModels().getTimeout())
                .mode(ResponseMode.JSON)
                .validator(content -> parseNarrative(chunk.filePath(), content).isPresent())
                .build();
        return modelCaller.callWithFallback(request)
                .thenApply(outcome -> toNarrative(chunk, outcome));
    }

    private ModuleNarrative toNarrative(CodeChunk chunk, ModelCallOutcome outcome) {
        if (!outcome.hasResult()) {
            log.debug("[LLM] No model produced a narrative for {}: {}", chunk.filePath(), outcome.failures());
            return ModuleNarrative.unavailable(chunk.filePath());
        }
        return parseNarrative(chunk.filePath(), outcome.content())
                .orElseGet(() -> ModuleNarrative.unavailable(chunk.filePath()));
    }

    private ModuleNarrative store(PipelineContext context, String hash, ModuleNarrative narrative) {
        if (narrative.isAvailable()) {
            checkpointPort.put(new AnalysisCheckpoint(context.getProjectId(), hash, narrative, Instant.now(clock)))
                    .exceptionally(error -> {
                        log.warn("[LLM] Failed to write checkpoint for {}: {}", narrative.filePath(),
                                error.getMessage());
                        return null;
                    });
        }
        return narrative;
    }

    static String buildPrompt(CodeChunk chunk, String code) {
        return "File: " + chunk.filePath() + " (lines " + chunk.startLine() + "-" + chunk.endLine() + ")\n"
                + "Language: " + chunk.language() + "\n\n"
                + "```" + chunk.language() + "\n" + code + "\n```";
    }

    Optional<ModuleNarrative> parseNarrative(String filePath, String content) {
        try {
            JsonNode root = objectMapper.readTree(ResilientModelCaller.stripCodeFence(content));
            String purpose = root.path("purpose").asText("").trim();
            if (purpose.isEmpty()) {
                return Optional.empty();
            }
            List<String> behaviors = new ArrayList<>();
            for (JsonNode behavior : root.path("behaviors")) {
                String text = behavior.asText("").trim();
                if (!text.isEmpty()) {
                    behaviors.add(text);
                }
            }
            return Optional.of(new ModuleNarrative(filePath, purpose, behaviors,
                    parseConfidence(root.path("confidence").asText(""))));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static ConfidenceLevel parseConfidence(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "high" -> ConfidenceLevel.HIGH;
        case "low" -> ConfidenceLevel.LOW;
        default -> ConfidenceLevel.MEDIUM;
        };
    }

    private static boolean acquire(Semaphore permits, long deadline, PipelineContext context) {
        try {
            while (true) {
                context.checkCancelled();
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS));
                if (permits.tryAcquire(slice, TimeUnit.NANOSECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            throw new CancellationException("Interrupted during chunk analysis");
        }
    }

    private static void awaitUntil(List<CompletableFuture<ModuleNarrative>> futures, long deadline,
            Duration timeout, PipelineContext context) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            while (!all.isDone()) {
                context.checkCancelled();
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("[LLM] Analysis timed out after {}s, keeping partial results", timeout.toSeconds());
                    return;
                }
                waitSlice(all, Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            throw new CancellationException("Interrupted during chunk analysis");
        } catch (ExecutionException e) {
            log.debug("[LLM] Chunk analysis finished with failures: {}", e.getMessage());
        }
    }

    private static boolean waitSlice(CompletableFuture<Void> all, long nanos)
            throws InterruptedException, ExecutionException {
        try {
            all.get(nanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }
}
