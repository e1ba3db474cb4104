package me.golemcore.artifactor.domain.resilience;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import me.golemcore.artifactor.domain.exception.ModelCallException;
import me.golemcore.artifactor.domain.model.ModelCallOutcome;
import me.golemcore.artifactor.domain.model.ModelMessage;
import me.golemcore.artifactor.domain.model.ModelReply;
import me.golemcore.artifactor.domain.model.ModelRequest;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.domain.model.TraceEvent;
import me.golemcore.artifactor.domain.model.TraceEventType;
import me.golemcore.artifactor.domain.service.TraceDispatcher;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.ModelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ResilientModelCallerTest {

    private static final String PRIMARY = "anthropic/claude-test";
    private static final String SECONDARY = "openai/gpt-test";

    private ModelPort modelPort;
    private TraceDispatcher traceDispatcher;
    private ArtifactorProperties properties;
    private ModelCircuitBreakers circuitBreakers;
    private ResilientModelCaller caller;

    @BeforeEach
    void setUp() {
        modelPort = mock(ModelPort.class);
        traceDispatcher = mock(TraceDispatcher.class);
        when(traceDispatcher.emit(any())).thenReturn(CompletableFuture.completedFuture(null));

        properties = new ArtifactorProperties();
        properties.getModels().setChain(List.of(PRIMARY, SECONDARY));
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(5));
        properties.getCircuitBreaker().setFailureThreshold(2);
        properties.getCircuitBreaker().setOpenDuration(Duration.ofMinutes(1));

        circuitBreakers = new ModelCircuitBreakers(properties);
        caller = new ResilientModelCaller(modelPort, circuitBreakers, traceDispatcher, properties,
                new ObjectMapper(), Clock.systemUTC());
    }

    @Test
    void shouldReturnFirstModelReply() throws Exception {
        stubReply(PRIMARY, "hello world");

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertTrue(outcome.hasResult());
        assertEquals(PRIMARY, outcome.model());
        assertEquals("hello world", outcome.content());
        verify(modelPort, never()).call(eq(SECONDARY), any(), any(), any());

        ArgumentCaptor<TraceEvent> event = ArgumentCaptor.forClass(TraceEvent.class);
        verify(traceDispatcher).emit(event.capture());
        assertEquals(TraceEventType.LLM_CALL, event.getValue().type());
        assertEquals(PRIMARY, event.getValue().data().get("model"));
    }

    @Test
    void shouldFallBackOnServerError() throws Exception {
        stubFailure(PRIMARY, new ModelCallException("overloaded", 503));
        stubReply(SECONDARY, "fallback answer");

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertEquals(SECONDARY, outcome.model());
        assertEquals(1, outcome.failures().size());
        assertTrue(outcome.failures().get(0).startsWith(PRIMARY + ": SERVER"));
    }

    @Test
    void shouldFallBackOnClientErrorWithoutRetrying() throws Exception {
        stubFailure(PRIMARY, new ModelCallException("model not found", 404));
        stubReply(SECONDARY, "secondary answer");

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertEquals(SECONDARY, outcome.model());
        assertEquals(1, outcome.failures().size());
        assertTrue(outcome.failures().get(0).startsWith(PRIMARY + ": CLIENT"));
        verify(modelPort, times(1)).call(eq(PRIMARY), any(), any(), any());
    }

    @Test
    void shouldReturnNoResultWhenEveryModelRejectsRequest() throws Exception {
        stubFailure(PRIMARY, new ModelCallException("bad request", 400));
        stubFailure(SECONDARY, new IllegalStateException("unexpected payload"));

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertFalse(outcome.hasResult());
        assertEquals(2, outcome.failures().size());
        assertTrue(outcome.failures().get(1).startsWith(SECONDARY + ": UNKNOWN"));
    }

    @Test
    void shouldRetrySameModelOnRateLimit() throws Exception {
        when(modelPort.call(eq(PRIMARY), any(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ModelCallException("slow down", 429)))
                .thenReturn(CompletableFuture.completedFuture(new ModelReply("after retry", 10, 5)));

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertEquals(PRIMARY, outcome.model());
        assertEquals("after retry", outcome.content());
        verify(modelPort, times(2)).call(eq(PRIMARY), any(), any(), any());
        assertEquals(CircuitBreaker.State.CLOSED, circuitBreakers.stateOf(PRIMARY));
    }

    @Test
    void shouldSkipModelWithOpenCircuit() throws Exception {
        stubFailure(PRIMARY, new ModelCallException("down", 500));
        stubReply(SECONDARY, "secondary answer");

        call(request(ResponseMode.TEXT));
        call(request(ResponseMode.TEXT));
        assertEquals(CircuitBreaker.State.OPEN, circuitBreakers.stateOf(PRIMARY));

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertEquals(SECONDARY, outcome.model());
        assertTrue(outcome.failures().contains(PRIMARY + ": circuit open"));
        verify(modelPort, times(2)).call(eq(PRIMARY), any(), any(), any());
    }

    @Test
    void shouldRejectInvalidJsonAndFallBack() throws Exception {
        stubReply(PRIMARY, "not json at all");
        stubReply(SECONDARY, "```json\n{\"purpose\": \"ok\"}\n```");

        ModelCallOutcome outcome = call(request(ResponseMode.JSON));

        assertEquals(SECONDARY, outcome.model());
        assertTrue(outcome.failures().get(0).contains("not valid JSON"));
    }

    @Test
    void shouldApplyValidatorAndMinLength() throws Exception {
        stubReply(PRIMARY, "tiny");
        stubReply(SECONDARY, "long enough but rejected");
        ModelRequest request = ModelRequest.builder()
                .purpose("test")
                .messages(List.of(ModelMessage.user("hi")))
                .minLength(10)
                .validator(content -> !content.contains("rejected"))
                .build();

        ModelCallOutcome outcome = call(request);

        assertFalse(outcome.hasResult());
        assertEquals(2, outcome.failures().size());
        assertTrue(outcome.failures().get(0).contains("shorter than 10"));
        assertTrue(outcome.failures().get(1).contains("failed validation"));
    }

    @Test
    void shouldReturnNoResultWhenChainExhausted() throws Exception {
        stubFailure(PRIMARY, new ModelCallException("timeout while reading"));
        stubFailure(SECONDARY, new ModelCallException("gateway", 502));

        ModelCallOutcome outcome = call(request(ResponseMode.TEXT));

        assertFalse(outcome.hasResult());
        assertNull(outcome.content());
        assertEquals(2, outcome.failures().size());
        verify(traceDispatcher, never()).emit(any());
    }

    @Test
    void shouldEstimateCostFromPricing() {
        ArtifactorProperties.PricingProperties pricing = new ArtifactorProperties.PricingProperties();
        pricing.setInputPerMillion(3.0);
        pricing.setOutputPerMillion(15.0);
        properties.getModels().getPricing().put(PRIMARY, pricing);

        double cost = caller.estimateCost(PRIMARY, new ModelReply("x", 1_000_000, 100_000));

        assertEquals(4.5, cost, 1e-9);
        assertEquals(0.0, caller.estimateCost(SECONDARY, new ModelReply("x", 10, 10)));
    }

    @Test
    void shouldStripCodeFence() {
        assertEquals("{\"a\":1}", ResilientModelCaller.stripCodeFence("```json\n{\"a\":1}\n```"));
        assertEquals("plain", ResilientModelCaller.stripCodeFence("  plain  "));
    }

    private ModelCallOutcome call(ModelRequest request) throws Exception {
        return caller.callWithFallback(request).get(5, TimeUnit.SECONDS);
    }

    private ModelRequest request(ResponseMode mode) {
        return ModelRequest.builder()
                .purpose("test")
                .traceId("trace-1")
                .messages(List.of(ModelMessage.system("sys"), ModelMessage.user("hi")))
                .timeout(Duration.ofSeconds(5))
                .mode(mode)
                .build();
    }

    private void stubReply(String model, String content) {
        when(modelPort.call(eq(model), any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(new ModelReply(content, 10, 5)));
    }

    private void stubFailure(String model, Exception error) {
        when(modelPort.call(eq(model), any(), any(), any()))
                .thenAnswer(invocation -> CompletableFuture.failedFuture(error));
    }
}
