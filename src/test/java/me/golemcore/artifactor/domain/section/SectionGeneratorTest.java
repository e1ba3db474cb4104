package me.golemcore.artifactor.domain.section;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.artifactor.domain.analysis.CrossValidator;
import me.golemcore.artifactor.domain.exception.ModelCallException;
import me.golemcore.artifactor.domain.model.Citation;
import me.golemcore.artifactor.domain.model.ModelCallOutcome;
import me.golemcore.artifactor.domain.model.ModelReply;
import me.golemcore.artifactor.domain.model.ModelRequest;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.domain.model.analysis.ApiEndpoints;
import me.golemcore.artifactor.domain.model.analysis.CallGraph;
import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.DependencyGraph;
import me.golemcore.artifactor.domain.model.analysis.EntityType;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.LanguageInfo;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.domain.model.analysis.LlmAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;
import me.golemcore.artifactor.domain.model.analysis.SectionOutput;
import me.golemcore.artifactor.domain.model.analysis.StaticAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ValidationResult;
import me.golemcore.artifactor.domain.resilience.ResilientModelCaller;
import me.golemcore.artifactor.domain.service.ConfidenceScorer;
import me.golemcore.artifactor.domain.service.GuardrailEvaluator;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SectionGeneratorTest {

    private static final String OVERVIEW = "# Executive Overview\n\n"
            + "The platform lets customers place, pay for and track orders online. ".repeat(6);

    private ResilientModelCaller modelCaller;
    private ArtifactorProperties properties;
    private ConfidenceScorer scorer;
    private SectionGenerator generator;

    @BeforeEach
    void setUp() {
        modelCaller = mock(ResilientModelCaller.class);
        properties = new ArtifactorProperties();
        scorer = new ConfidenceScorer();
        generator = new SectionGenerator(modelCaller, new SectionContextBuilder(new ObjectMapper()),
                new SectionQualityGate(), scorer, new GuardrailEvaluator(mock(SourceAccessPort.class), properties),
                properties);
    }

    @Test
    void shouldUseModelDraftWithRichContextConfidence() {
        when(modelCaller.callWithFallback(any(ModelRequest.class))).thenReturn(reply(OVERVIEW));
        IntelligenceModel model = model(entities(5));

        SectionOutput section = generator.generate(model, "executive_overview", "pipeline_p1");

        assertEquals("Executive Overview", section.title());
        assertEquals(OVERVIEW.strip(), section.content());
        assertEquals(0.90, section.confidence(), 1e-9);
        assertFalse(section.gated());
        assertFalse(section.degraded());

        ArgumentCaptor<ModelRequest> request = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelCaller).callWithFallback(request.capture());
        assertEquals(ResponseMode.TEXT, request.getValue().mode());
        assertEquals(50, request.getValue().minLength());
        assertTrue(request.getValue().messages().get(1).content().startsWith("<context>"));
    }

    @Test
    void shouldFallBackToTemplateWhenNoModelAnswers() {
        when(modelCaller.callWithFallback(any(ModelRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ModelCallOutcome.noResult(List.of("down"))));

        SectionOutput section = generator.generate(model(entities(2)), "features", "pipeline_p1");

        assertTrue(section.content().contains("## Feature Areas"));
        assertEquals(0.50, section.confidence(), 1e-9);
        assertTrue(section.gated());
        assertTrue(section.content().startsWith("[Low confidence: 0.50] # Main Application Features"));
    }

    @Test
    void shouldFallBackToTemplateWhenModelCallFails() {
        when(modelCaller.callWithFallback(any(ModelRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new ModelCallException("Provider not configured")));

        SectionOutput section = generator.generate(model(entities(1)), "api_specs", "pipeline_p1");

        assertTrue(section.content().contains("## Endpoints"));
        assertFalse(section.degraded());
    }

    @Test
    void shouldRetryUntilIterationsExhaustedAndKeepLastDraft() {
        String shortDraft = "# Executive Overview\n\nA short summary that is not long enough for the gate.";
        when(modelCaller.callWithFallback(any(ModelRequest.class))).thenReturn(reply(shortDraft));

        SectionOutput section = generator.generate(model(List.of()), "executive_overview", "pipeline_p1");

        verify(modelCaller, times(2)).callWithFallback(any(ModelRequest.class));
        assertEquals(scorer.adjustForGate(0.80, 2.0 / 3.0), section.confidence(), 1e-9);
        assertTrue(section.gated());
        assertTrue(section.content().endsWith(shortDraft));
    }

    @Test
    void shouldCiteFirstEntitiesInFileOrder() {
        when(modelCaller.callWithFallback(any(ModelRequest.class))).thenReturn(reply(OVERVIEW));
        List<CodeEntity> entities = new ArrayList<>(entities(12));
        entities.add(0, new CodeEntity("first", EntityType.FUNCTION, "a_first.py", 3, 8));

        SectionOutput section = generator.generate(model(entities), "executive_overview", "pipeline_p1");

        List<Citation> citations = section.citations();
        assertEquals(SectionGenerator.MAX_CITATIONS, citations.size());
        assertEquals("a_first.py", citations.get(0).filePath());
        assertEquals("first", citations.get(0).functionName());
        assertEquals(0.90, citations.get(0).confidence());
    }

    private static CompletableFuture<ModelCallOutcome> reply(String content) {
        return CompletableFuture.completedFuture(
                ModelCallOutcome.success("openai/gpt-test", new ModelReply(content, 500, 300), List.of()));
    }

    private static List<CodeEntity> entities(int count) {
        List<CodeEntity> entities = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entities.add(new CodeEntity("handler" + i, EntityType.FUNCTION, "src/module" + i + ".py", 1, 10));
        }
        return entities;
    }

    private static IntelligenceModel model(List<CodeEntity> entities) {
        ParsedFile file = new ParsedFile("src", "python", List.of(), entities, List.of());
        StaticAnalysisResult staticAnalysis = new StaticAnalysisResult(new ParsedSources(List.of(file)),
                CallGraph.empty(), DependencyGraph.empty(), SchemaMap.empty(), ApiEndpoints.empty());
        ValidationResult validation = new CrossValidator(new ConfidenceScorer())
                .validate(staticAnalysis, LlmAnalysisResult.empty());
        LanguageMap languages = new LanguageMap(List.of(new LanguageInfo("python", entities.size(), 100,
                List.of(".py"))), "python");
        return new IntelligenceModel("p1", languages, staticAnalysis, LlmAnalysisResult.empty(), validation,
                Instant.parse("2026-01-01T00:00:00Z"));
    }
}
