package me.golemcore.artifactor.adapter.outbound.trace;

import me.golemcore.artifactor.domain.model.TraceCategory;
import me.golemcore.artifactor.domain.trace.TraceEvents;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTraceHandlerTest {

    @Test
    void shouldFormatEventAsKeyValueLine() {
        String line = ConsoleTraceHandler.format(TraceEvents.stageStart("pipeline_p1",
                Instant.parse("2026-01-01T00:00:00Z"), "chunking", TraceCategory.PIPELINE));

        assertEquals("trace_type=stage_start trace_id=pipeline_p1 category=pipeline stage=chunking", line);
    }

    @Test
    void shouldCompleteHandleImmediately() {
        ConsoleTraceHandler handler = new ConsoleTraceHandler();

        assertTrue(handler.handle(TraceEvents.pipelineStart("t", Instant.EPOCH, "p")).isDone());
        assertEquals("console", handler.getName());
    }
}
