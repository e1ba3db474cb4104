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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.StageStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs several stages concurrently on the same context.
 *
 * <p>
 * Every stage runs to completion or failure on its own; a failing stage never
 * cancels its siblings. An optional semaphore bounds how many stages run at
 * once. With a timeout, stages still unfinished at the deadline are recorded
 * as failed and their defaults are used. Results are returned in declaration
 * order.
 */
@Slf4j
public class ParallelStageGroup {

    private final String name;
    private final List<PipelineStage<?>> stages;
    private final int maxConcurrency;
    private final Duration timeout;

    public ParallelStageGroup(String name, List<? extends PipelineStage<?>> stages, int maxConcurrency,
            Duration timeout) {
        this.name = name;
        this.stages = List.copyOf(stages);
        this.maxConcurrency = maxConcurrency;
        this.timeout = timeout;
    }

    public String getName() {
        return name;
    }

    public List<StageResult<?>> execute(PipelineContext context, StageExecutor stageExecutor, Executor executor) {
        if (stages.isEmpty()) {
            return List.of();
        }
        long startNanos = System.nanoTime();
        Semaphore semaphore = maxConcurrency > 0 ? new Semaphore(maxConcurrency) : null;
        List<Slot> slots = new ArrayList<>(stages.size());
        List<CompletableFuture<StageResult<?>>> futures = new ArrayList<>(stages.size());

        for (PipelineStage<?> stage : stages) {
            Slot slot = new Slot(stage);
            slots.add(slot);
            futures.add(CompletableFuture.supplyAsync(
                    () -> runGuarded(slot, context, stageExecutor, semaphore), executor));
        }

        awaitAll(context, futures);

        List<StageResult<?>> results = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            results.add(collect(slots.get(i), futures.get(i), context, stageExecutor, startNanos));
        }
        return results;
    }

    private StageResult<?> runGuarded(Slot slot, PipelineContext context, StageExecutor stageExecutor,
            Semaphore semaphore) {
        if (semaphore == null) {
            return start(slot, context, stageExecutor);
        }
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted waiting to start " + slot.stage.getName());
        }
        try {
            return start(slot, context, stageExecutor);
        } finally {
            semaphore.release();
        }
    }

    private StageResult<?> start(Slot slot, PipelineContext context, StageExecutor stageExecutor) {
        synchronized (slot) {
            if (slot.started) {
                // abandoned by the group before a permit was free
                return null;
            }
            slot.started = true;
            stageExecutor.reportStart(slot.stage, context);
        }
        return stageExecutor.runStarted(slot.stage, context, slot.claimed);
    }

    private void awaitAll(PipelineContext context, List<CompletableFuture<StageResult<?>>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                all.get();
            }
        } catch (TimeoutException e) {
            log.error("[Pipeline] Parallel group {} timed out after {}s", name, timeout.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            throw new CancellationException("Interrupted while running " + name);
        } catch (ExecutionException e) {
            log.debug("[Pipeline] Parallel group {} finished with failures", name);
        }
    }

    private StageResult<?> collect(Slot slot, CompletableFuture<StageResult<?>> future, PipelineContext context,
            StageExecutor stageExecutor, long startNanos) {
        if (future.isDone() && !future.isCompletedExceptionally()) {
            StageResult<?> result = future.join();
            if (result != null) {
                return result;
            }
        }
        if (future.isCompletedExceptionally()) {
            Throwable error = unwrap(future);
            if (error instanceof CancellationException cancellation) {
                throw cancellation;
            }
            return failed(slot, context, stageExecutor, StageExecutor.describeError(error), startNanos);
        }
        future.cancel(true);
        return failed(slot, context, stageExecutor, "timed out after " + timeout.toSeconds() + "s", startNanos);
    }

    /**
     * Record a stage the group gave up on. A stage that never got to start still
     * reports its running event first, so every stage shows running before its
     * terminal event.
     */
    private StageResult<?> failed(Slot slot, PipelineContext context, StageExecutor stageExecutor, String error,
            long startNanos) {
        String stageName = slot.stage.getName();
        double durationMs = StageExecutor.elapsedMs(startNanos);
        synchronized (slot) {
            if (!slot.started) {
                slot.started = true;
                stageExecutor.reportStart(slot.stage, context);
            }
        }
        if (slot.claimed.compareAndSet(false, true)) {
            context.report(StageEvent.error(stageName, error, durationMs));
            stageExecutor.emitStageEnd(context, stageName, durationMs, false, error);
        }
        return new StageResult<>(slot.stage.defaultResult(), StageStatus.failed(stageName, durationMs, error));
    }

    private static Throwable unwrap(CompletableFuture<?> future) {
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        }
    }

    private static final class Slot {

        private final PipelineStage<?> stage;
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private boolean started;

        private Slot(PipelineStage<?> stage) {
            this.stage = stage;
        }
    }
}
