package me.golemcore.artifactor.domain.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.artifactor.adapter.outbound.checkpoint.InMemoryCheckpointAdapter;
import me.golemcore.artifactor.domain.model.ConfidenceLevel;
import me.golemcore.artifactor.domain.model.ModelCallOutcome;
import me.golemcore.artifactor.domain.model.ModelReply;
import me.golemcore.artifactor.domain.model.ModelRequest;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.analysis.CodeChunk;
import me.golemcore.artifactor.domain.model.analysis.LlmAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ModuleNarrative;
import me.golemcore.artifactor.domain.pipeline.PipelineContext;
import me.golemcore.artifactor.domain.resilience.ResilientModelCaller;
import me.golemcore.artifactor.domain.service.GuardrailEvaluator;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmChunkAnalyzerTest {

    private static final String NARRATIVE_JSON = """
            {"purpose": "Manages customer orders", "behaviors": ["creates orders", "cancels orders"],
             "confidence": "high"}""";

    private ResilientModelCaller modelCaller;
    private InMemoryCheckpointAdapter checkpoints;
    private ArtifactorProperties properties;
    private LlmChunkAnalyzer analyzer;
    private List<StageEvent> events;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        modelCaller = mock(ResilientModelCaller.class);
        checkpoints = new InMemoryCheckpointAdapter();
        properties = new ArtifactorProperties();
        properties.getAnalysis().setProgressEvery(1);
        GuardrailEvaluator guardrails = new GuardrailEvaluator(mock(SourceAccessPort.class), properties);
        analyzer = new LlmChunkAnalyzer(modelCaller, checkpoints, guardrails, properties, new ObjectMapper(),
                Clock.systemUTC());
        events = new CopyOnWriteArrayList<>();
        context = new PipelineContext("p1", "pipeline_p1", Path.of("."), List.of(), events::add);
    }

    @Test
    void shouldAnalyzeChunksAndReportProgress() {
        when(modelCaller.callWithFallback(any(ModelRequest.class))).thenReturn(success(NARRATIVE_JSON));

        LlmAnalysisResult result = analyzer.analyze(context, List.of(chunk("orders.py", 1), chunk("orders.py", 11)));

        assertEquals(2, result.chunksAnalyzed());
        assertEquals(0, result.failedChunks());
        ModuleNarrative narrative = result.narratives().get(0);
        assertEquals("Manages customer orders", narrative.purpose());
        assertEquals(List.of("creates orders", "cancels orders"), narrative.behaviors());
        assertEquals(ConfidenceLevel.HIGH, narrative.confidence());

        assertEquals(2, events.size());
        StageEvent last = events.get(events.size() - 1);
        assertEquals(2, last.completed());
        assertEquals(2, last.total());
        assertEquals(100.0, last.percent());
    }

    @Test
    void shouldRequestJsonWithValidator() {
        when(modelCaller.callWithFallback(any(ModelRequest.class))).thenReturn(success(NARRATIVE_JSON));

        analyzer.analyze(context, List.of(chunk("orders.py", 1)));

        ArgumentCaptor<ModelRequest> request = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelCaller).callWithFallback(request.capture());
        assertEquals(ResponseMode.JSON, request.getValue().mode());
        assertEquals("pipeline_p1", request.getValue().traceId());
        assertTrue(request.getValue().validator().test(NARRATIVE_JSON));
        assertFalse(request.getValue().validator().test("{\"behaviors\": []}"));
    }

    @Test
    void shouldReuseCheckpointsOnSecondRun() {
        when(modelCaller.callWithFallback(any(ModelRequest.class))).thenReturn(success(NARRATIVE_JSON));
        List<CodeChunk> chunks = List.of(chunk("orders.py", 1), chunk("billing.py", 1));

        analyzer.analyze(context, chunks);
        LlmAnalysisResult second = analyzer.analyze(context, chunks);

        assertEquals(2, second.checkpointHits());
        assertEquals(2, second.chunksAnalyzed());
        verify(modelCaller, times(2)).callWithFallback(any(ModelRequest.class));
    }

    @Test
    void shouldMarkChunkUnavailableWithoutCheckpoint() {
        when(modelCaller.callWithFallback(any(ModelRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ModelCallOutcome.noResult(List.of("all failed"))));
        CodeChunk chunk = chunk("orders.py", 1);

        LlmAnalysisResult result = analyzer.analyze(context, List.of(chunk));

        assertEquals(1, result.failedChunks());
        assertFalse(result.narratives().get(0).isAvailable());
        assertEquals(Optional.empty(), checkpoints.get("p1", chunk.hash()).join());
    }

    @Test
    void shouldDegradeChunkWhenModelCallFails() {
        when(modelCaller.callWithFallback(any(ModelRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("client error")));

        LlmAnalysisResult result = analyzer.analyze(context, List.of(chunk("orders.py", 1)));

        assertEquals(1, result.chunksAnalyzed());
        assertEquals(1, result.failedChunks());
        assertEquals(ModuleNarrative.UNAVAILABLE_PURPOSE, result.narratives().get(0).purpose());
    }

    @Test
    void shouldSkipNonCodeChunks() {
        LlmAnalysisResult result = analyzer.analyze(context, List.of(
                new CodeChunk("config.json", "json", 1, 3, "{}"),
                new CodeChunk("README.md", "markdown", 1, 1, "# hi")));

        assertEquals(LlmAnalysisResult.empty(), result);
        verifyNoInteractions(modelCaller);
    }

    @Test
    void shouldParseNarrativeWithDefaults() {
        Optional<ModuleNarrative> parsed = analyzer.parseNarrative("a.py",
                "```json\n{\"purpose\": \"Sends emails\", \"behaviors\": [\"\", \"sends mail\"]}\n```");

        assertTrue(parsed.isPresent());
        assertEquals(ConfidenceLevel.MEDIUM, parsed.get().confidence());
        assertEquals(List.of("sends mail"), parsed.get().behaviors());
        assertTrue(analyzer.parseNarrative("a.py", "{\"purpose\": \"  \"}").isEmpty());
        assertTrue(analyzer.parseNarrative("a.py", "not json").isEmpty());
    }

    @Test
    void shouldBuildPromptWithLocation() {
        String prompt = LlmChunkAnalyzer.buildPrompt(chunk("orders.py", 11), "code");

        assertTrue(prompt.startsWith("File: orders.py (lines 11-20)"));
        assertTrue(prompt.contains("```python\ncode\n```"));
    }

    private static CodeChunk chunk(String file, int startLine) {
        return new CodeChunk(file, "python", startLine, startLine + 9, "def create_order():\n    pass # " + startLine);
    }

    private static CompletableFuture<ModelCallOutcome> success(String content) {
        return CompletableFuture.completedFuture(
                ModelCallOutcome.success("openai/gpt-test", new ModelReply(content, 100, 20), List.of()));
    }
}
