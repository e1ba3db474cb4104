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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.ArtifactorConstants;
import me.golemcore.artifactor.domain.exception.StageFailedException;
import me.golemcore.artifactor.domain.model.Citation;
import me.golemcore.artifactor.domain.model.ModelCallOutcome;
import me.golemcore.artifactor.domain.model.ModelMessage;
import me.golemcore.artifactor.domain.model.ModelRequest;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.SectionOutput;
import me.golemcore.artifactor.domain.model.analysis.ValidatedEntity;
import me.golemcore.artifactor.domain.resilience.ResilientModelCaller;
import me.golemcore.artifactor.domain.service.ConfidenceScorer;
import me.golemcore.artifactor.domain.service.GuardrailEvaluator;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Produces one documentation section. Each attempt asks the model chain and
 * falls back to a template; the result goes through the section quality gate
 * and is retried until it passes or the iteration budget is spent. The last
 * attempt is always kept, with its confidence lowered by the gate score.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionGenerator {

    static final int MIN_RICH_CONTEXT_ITEMS = 3;
    static final int MAX_CITATIONS = 10;

    private final ResilientModelCaller modelCaller;
    private final SectionContextBuilder contextBuilder;
    private final SectionQualityGate qualityGate;
    private final ConfidenceScorer confidenceScorer;
    private final GuardrailEvaluator guardrailEvaluator;
    private final ArtifactorProperties properties;

    private record Draft(String content, double confidence) {
    }

    public SectionOutput generate(IntelligenceModel model, String sectionName, String traceId) {
        SectionGateConfig config = SectionGateConfig.forSection(sectionName);
        int maxIterations = Math.max(1, properties.getAnalysis().getSectionMaxIterations());

        for (int attempt = 1; attempt <= maxIterations; attempt++) {
            Draft draft = draft(model, sectionName, traceId, config);
            SectionQualityGate.GateResult gate = qualityGate.evaluate(sectionName, draft.content(), config);
            if (gate.passed() || attempt == maxIterations) {
                double confidence = confidenceScorer.adjustForGate(draft.confidence(), gate.score());
                log.info("[Section] {} gate passed={} score={} confidence={} attempt={}", sectionName,
                        gate.passed(), String.format(Locale.ROOT, "%.2f", gate.score()),
                        String.format(Locale.ROOT, "%.2f", confidence), attempt);
                GuardrailEvaluator.GatedOutput gated = guardrailEvaluator.gateLowConfidence(draft.content(),
                        confidence);
                return new SectionOutput(sectionName, SectionCatalog.title(sectionName), gated.content(), confidence,
                        citations(model), gated.gated(), false);
            }
            log.warn("[Section] {} gate retry: score={} failures={} attempt={}", sectionName,
                    String.format(Locale.ROOT, "%.2f", gate.score()), gate.failures().size(), attempt);
        }
        throw new StageFailedException(ArtifactorConstants.SECTION_STAGE_PREFIX + sectionName,
                "Section '" + sectionName + "' failed all " + maxIterations + " quality gate iterations");
    }

    private Draft draft(IntelligenceModel model, String sectionName, String traceId, SectionGateConfig config) {
        SectionContextBuilder.SectionContext context = contextBuilder.build(model, sectionName);
        ModelRequest request = ModelRequest.builder()
                .purpose("section:" + sectionName)
                .traceId(traceId)
                .messages(List.of(
                        ModelMessage.system(SectionCatalog.systemPrompt(sectionName)),
                        ModelMessage.user(context.prompt())))
                .timeout(properties.getModels().getTimeout())
                .mode(ResponseMode.TEXT)
                .minLength(Math.min(config.minLength(), 50))
                .build();

        ModelCallOutcome outcome;
        try {
            outcome = await(modelCaller, request);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Section] {} model call failed: {}", sectionName, e.getMessage());
            outcome = ModelCallOutcome.noResult(List.of(e.getMessage() != null ? e.getMessage() : "model error"));
        }
        if (outcome.hasResult()) {
            log.info("[Section] {} synthesized by {} ({} tokens)", sectionName, outcome.model(),
                    outcome.reply().totalTokens());
            double base = context.itemCount() >= MIN_RICH_CONTEXT_ITEMS
                    ? ArtifactorConstants.CONFIDENCE_SECTION_RICH
                    : ArtifactorConstants.CONFIDENCE_SECTION_SPARSE;
            return new Draft(outcome.content().strip(), base);
        }
        log.info("[Section] {} falling back to template", sectionName);
        return new Draft(SectionTemplates.render(model, sectionName), ArtifactorConstants.CONFIDENCE_SECTION_TEMPLATE);
    }

    private static ModelCallOutcome await(ResilientModelCaller caller, ModelRequest request) {
        try {
            return caller.callWithFallback(request).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while generating " + request.purpose());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw cause instanceof RuntimeException runtime ? runtime : new CompletionException(cause);
        }
    }

    List<Citation> citations(IntelligenceModel model) {
        Map<String, Double> confidenceByLocation = new HashMap<>();
        for (ValidatedEntity entity : model.validation().entities()) {
            confidenceByLocation.put(entity.filePath() + ":" + entity.line(), entity.score().value());
        }
        List<Citation> citations = new ArrayList<>();
        model.staticAnalysis().parsed().entities().stream()
                .sorted(Comparator.comparing(CodeEntity::filePath).thenComparingInt(CodeEntity::startLine))
                .limit(MAX_CITATIONS)
                .forEach(entity -> citations.add(new Citation(entity.filePath(), entity.name(), entity.startLine(),
                        entity.endLine(), confidenceByLocation.getOrDefault(
                                entity.filePath() + ":" + entity.startLine(),
                                ArtifactorConstants.CONFIDENCE_AST_ONLY))));
        return citations;
    }
}
