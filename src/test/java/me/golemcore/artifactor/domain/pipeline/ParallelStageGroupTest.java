package me.golemcore.artifactor.domain.pipeline;

import me.golemcore.artifactor.domain.model.StageEvent;
import me.golemcore.artifactor.domain.model.StageProgress;
import me.golemcore.artifactor.domain.model.TraceEvent;
import me.golemcore.artifactor.domain.model.TraceEventType;
import me.golemcore.artifactor.domain.service.TraceDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ParallelStageGroupTest {

    private ExecutorService pool;
    private StageExecutor stageExecutor;
    private List<StageEvent> events;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        stageExecutor = new StageExecutor(new TraceDispatcher(), Clock.systemUTC());
        events = new CopyOnWriteArrayList<>();
        context = new PipelineContext("p1", "pipeline_p1", Path.of("."), List.of(), events::add);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldReturnResultsInDeclarationOrder() {
        ParallelStageGroup group = new ParallelStageGroup("group", List.of(
                stage("slow", () -> {
                    sleep(50);
                    return "slow";
                }),
                stage("fast", () -> "fast")), 0, null);

        List<StageResult<?>> results = group.execute(context, stageExecutor, pool);

        assertEquals(List.of("slow", "fast"), results.stream().map(StageResult::value).toList());
        assertTrue(results.stream().allMatch(StageResult::ok));
    }

    @Test
    void shouldIsolateFailingStage() {
        ParallelStageGroup group = new ParallelStageGroup("group", List.of(
                FunctionalStage.<String>builder()
                        .name("broken")
                        .body(ctx -> {
                            throw new IllegalStateException("parser crashed");
                        })
                        .fallback(() -> "empty")
                        .build(),
                stage("healthy", () -> "ok")), 0, null);

        List<StageResult<?>> results = group.execute(context, stageExecutor, pool);

        assertFalse(results.get(0).ok());
        assertEquals("empty", results.get(0).value());
        assertTrue(results.get(1).ok());
    }

    @Test
    void shouldLimitConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<PipelineStage<?>> stages = List.of(
                countingStage("a", running, peak),
                countingStage("b", running, peak),
                countingStage("c", running, peak),
                countingStage("d", running, peak));

        new ParallelStageGroup("group", stages, 2, null).execute(context, stageExecutor, pool);

        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void shouldFailUnfinishedStagesOnTimeoutWithSingleTerminalEvent() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ParallelStageGroup group = new ParallelStageGroup("group", List.of(
                stage("stuck", () -> {
                    awaitQuietly(release);
                    return "late";
                }),
                stage("quick", () -> "ok")), 0, Duration.ofMillis(200));

        List<StageResult<?>> results = group.execute(context, stageExecutor, pool);
        release.countDown();
        pool.shutdown();
        pool.awaitTermination(2, TimeUnit.SECONDS);

        assertFalse(results.get(0).ok());
        assertTrue(results.get(0).status().error().contains("timed out"));
        assertTrue(results.get(1).ok());

        long stuckTerminals = events.stream()
                .filter(event -> "stuck".equals(event.name()))
                .filter(event -> event.status().isTerminal())
                .count();
        assertEquals(1, stuckTerminals);
        assertTrue(events.stream().anyMatch(event -> "stuck".equals(event.name())
                && event.status() == StageProgress.ERROR));
    }

    @Test
    void shouldReportRunningBeforeErrorForStagesStillQueuedAtTimeout() throws Exception {
        TraceDispatcher traceDispatcher = mock(TraceDispatcher.class);
        when(traceDispatcher.emit(any())).thenReturn(CompletableFuture.completedFuture(null));
        StageExecutor tracedExecutor = new StageExecutor(traceDispatcher, Clock.systemUTC());
        CountDownLatch release = new CountDownLatch(1);
        ParallelStageGroup group = new ParallelStageGroup("sections", List.of(
                stage("first", () -> {
                    awaitQuietly(release);
                    return "a";
                }),
                stage("second", () -> {
                    awaitQuietly(release);
                    return "b";
                })), 1, Duration.ofMillis(200));

        List<StageResult<?>> results = group.execute(context, tracedExecutor, pool);
        release.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(2, TimeUnit.SECONDS));

        for (String stageName : List.of("first", "second")) {
            List<StageProgress> statuses = events.stream()
                    .filter(event -> stageName.equals(event.name()))
                    .map(StageEvent::status)
                    .toList();
            assertEquals(List.of(StageProgress.RUNNING, StageProgress.ERROR), statuses, stageName);
        }
        assertTrue(results.stream().noneMatch(StageResult::ok));
        assertTrue(results.stream().allMatch(result -> result.status().durationMs() >= 200.0));
        assertTrue(events.stream()
                .filter(event -> event.status() == StageProgress.ERROR)
                .allMatch(event -> event.durationMs() >= 200.0));

        ArgumentCaptor<TraceEvent> traces = ArgumentCaptor.forClass(TraceEvent.class);
        verify(traceDispatcher, times(4)).emit(traces.capture());
        assertEquals(2, traces.getAllValues().stream()
                .filter(trace -> trace.type() == TraceEventType.STAGE_START)
                .count());
        assertEquals(2, traces.getAllValues().stream()
                .filter(trace -> trace.type() == TraceEventType.STAGE_END)
                .count());
    }

    @Test
    void shouldReturnEmptyForNoStages() {
        assertTrue(new ParallelStageGroup("group", List.of(), 0, null)
                .execute(context, stageExecutor, pool).isEmpty());
    }

    private static PipelineStage<String> stage(String name, Supplier<String> body) {
        return FunctionalStage.<String>builder()
                .name(name)
                .body(ctx -> body.get())
                .build();
    }

    private static PipelineStage<String> countingStage(String name, AtomicInteger running, AtomicInteger peak) {
        return stage(name, () -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleep(30);
            running.decrementAndGet();
            return name;
        });
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
