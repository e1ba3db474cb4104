package me.golemcore.artifactor.adapter.outbound.trace;

import me.golemcore.artifactor.domain.trace.TraceEvents;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CostAggregatorTraceHandlerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldAccumulateLlmCallsPerTrace() {
        CostAggregatorTraceHandler handler = new CostAggregatorTraceHandler();

        handler.handle(TraceEvents.llmCall("t1", NOW, "openai/gpt-4o-mini", 100, 20, 12.0, 0.01));
        handler.handle(TraceEvents.llmCall("t1", NOW, "openai/gpt-4o-mini", 50, 10, 8.0, 0.005));
        handler.handle(TraceEvents.llmCall("t2", NOW, "openai/gpt-4o-mini", 1, 1, 1.0, 0.001));

        CostAggregatorTraceHandler.TraceCost cost = handler.getCost("t1");
        assertEquals(150, cost.inputTokens());
        assertEquals(30, cost.outputTokens());
        assertEquals(0.015, cost.totalCost(), 1e-9);
        assertEquals(2, cost.callCount());
        assertEquals(2, handler.allCosts().size());
    }

    @Test
    void shouldIgnoreNonLlmEvents() {
        CostAggregatorTraceHandler handler = new CostAggregatorTraceHandler();

        handler.handle(TraceEvents.pipelineStart("t1", NOW, "p1"));

        assertEquals(CostAggregatorTraceHandler.TraceCost.ZERO, handler.getCost("t1"));
    }
}
