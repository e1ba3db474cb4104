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
import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.StageStatus;
import me.golemcore.artifactor.domain.service.TraceDispatcher;
import me.golemcore.artifactor.domain.trace.TraceEvents;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a single stage with timing, progress events, trace events and error
 * isolation.
 *
 * <p>
 * Emits one running event before the body and exactly one terminal event
 * after it. A failing body is logged, recorded as a failed
 * {@link StageStatus} and replaced by the stage's default result. Cancellation
 * is not treated as a failure and propagates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StageExecutor {

    private final TraceDispatcher traceDispatcher;
    private final Clock clock;

    public <T> StageResult<T> run(PipelineStage<T> stage, PipelineContext context) {
        return run(stage, context, new AtomicBoolean(false));
    }

    /**
     * Run a stage whose terminal event may be claimed by someone else, such as a
     * parallel group that gave up waiting. The terminal event is only emitted by
     * whoever sets {@code terminalClaimed} first.
     */
    public <T> StageResult<T> run(PipelineStage<T> stage, PipelineContext context, AtomicBoolean terminalClaimed) {
        reportStart(stage, context);
        return runStarted(stage, context, terminalClaimed);
    }

    void reportStart(PipelineStage<?> stage, PipelineContext context) {
        context.report(StageEvent.running(stage.getName(), stage.describe(context)));
        traceDispatcher.emit(TraceEvents.stageStart(context.getTraceId(), Instant.now(clock), stage.getName(),
                stage.getCategory()));
    }

    /**
     * Run the body of a stage whose running event was already reported.
     */
    <T> StageResult<T> runStarted(PipelineStage<T> stage, PipelineContext context, AtomicBoolean terminalClaimed) {
        String name = stage.getName();
        long startNanos = System.nanoTime();
        try {
            T value = stage.execute(context);
            double durationMs = elapsedMs(startNanos);
            if (terminalClaimed.compareAndSet(false, true)) {
                context.report(StageEvent.done(name, stage.summarize(value), durationMs));
                emitStageEnd(context, name, durationMs, true, null);
            }
            log.debug("[Pipeline] Stage {} completed in {}ms", name, Math.round(durationMs));
            return new StageResult<>(value, StageStatus.ok(name, durationMs));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (context.isCancelled()) {
                throw new CancellationException("Stage " + name + " interrupted by cancellation");
            }
            double durationMs = elapsedMs(startNanos);
            String error = describeError(e);
            log.error("[Pipeline] Stage {} failed: {}", name, error, e);
            traceDispatcher.emit(TraceEvents.error(context.getTraceId(), Instant.now(clock), name, error));
            if (terminalClaimed.compareAndSet(false, true)) {
                context.report(StageEvent.error(name, error, durationMs));
                emitStageEnd(context, name, durationMs, false, error);
            }
            return new StageResult<>(stage.defaultResult(), StageStatus.failed(name, durationMs, error));
        }
    }

    void emitStageEnd(PipelineContext context, String name, double durationMs, boolean ok, String error) {
        traceDispatcher.emit(TraceEvents.stageEnd(context.getTraceId(), Instant.now(clock), name, durationMs, ok,
                error));
    }

    static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    static String describeError(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getMessage() == null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
