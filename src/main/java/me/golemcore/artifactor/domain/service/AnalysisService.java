package me.golemcore.artifactor.domain.service;

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
import me.golemcore.artifactor.domain.exception.ProjectNotFoundException;
import me.golemcore.artifactor.domain.model.AnalysisStatusView;
import me.golemcore.artifactor.domain.model.ProgressEnvelope;
import me.golemcore.artifactor.domain.model.Project;
import me.golemcore.artifactor.domain.model.ProjectStatus;
import me.golemcore.artifactor.domain.model.RunResult;
import me.golemcore.artifactor.domain.model.SseEventType;
import me.golemcore.artifactor.domain.pipeline.PipelineContext;
import me.golemcore.artifactor.domain.pipeline.PipelineExecutors;
import me.golemcore.artifactor.domain.pipeline.PipelineRunner;
import me.golemcore.artifactor.domain.trace.TraceEvents;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.ProjectPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts, streams, pauses and reports project analyses.
 *
 * <p>
 * One run per project at a time: the run is keyed {@code analyze:<id>} in the
 * {@link IdempotencyGuard} and the project status moves to
 * {@link ProjectStatus#ANALYZING} by compare-and-set. The starting caller gets
 * a dedicated stream that completes after the run; callers arriving while the
 * run is live subscribe to the replayed broadcast log instead. Every
 * run ends with exactly one {@code complete}, {@code error} or {@code paused}
 * envelope.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisService {

    static final String ALREADY_RUNNING = "Analysis already in progress";
    static final String RUN_FAILED = "Analysis failed. Check server logs for details.";

    private final IdempotencyGuard idempotencyGuard;
    private final ProgressEventBus<ProgressEnvelope> progressBus;
    private final PipelineRunner pipelineRunner;
    private final ProjectPort projectPort;
    private final PipelineExecutors executors;
    private final ArtifactorProperties properties;

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final Object startLock = new Object();

    public Flux<ProgressEnvelope> analyze(String projectId) {
        Project project = projectPort.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        String key = ArtifactorConstants.analysisKey(projectId);

        RunHandle handle;
        // claiming the project and opening its channel happen together, so a
        // concurrent caller never sees a claimed run without its channel
        synchronized (startLock) {
            if (progressBus.hasActiveChannel(key)) {
                log.info("[Analysis] Project {} already running, attaching to progress stream", projectId);
                return progressBus.subscribe(key);
            }
            if (!projectPort.compareAndSetStatus(projectId, ProjectStatus.STARTABLE, ProjectStatus.ANALYZING)) {
                log.warn("[Analysis] Project {} cannot start from status {}", projectId, project.getStatus());
                return Flux.just(ProgressEnvelope.error(ALREADY_RUNNING));
            }
            progressBus.createChannel(key);
            handle = new RunHandle(key, progressBus);
        }
        PipelineContext context = new PipelineContext(projectId, TraceEvents.pipelineTraceId(projectId),
                Path.of(project.getSourcePath()), properties.getAnalysis().getSections(),
                event -> handle.publish(ProgressEnvelope.stage(event)));
        handle.context = context;
        runs.put(projectId, handle);

        CompletableFuture<RunResult> run = idempotencyGuard.execute(key,
                () -> CompletableFuture.supplyAsync(() -> execute(projectId, handle), executors.run()));
        run.whenComplete((result, error) -> handle.completePrimary());
        return handle.primaryFlux();
    }

    /**
     * Pause a running analysis. The run stops at the next stage boundary.
     *
     * @return true if a running analysis was paused
     */
    public boolean pause(String projectId) {
        if (!projectPort.compareAndSetStatus(projectId, EnumSet.of(ProjectStatus.ANALYZING), ProjectStatus.PAUSED)) {
            return false;
        }
        RunHandle handle = runs.get(projectId);
        if (handle != null) {
            handle.terminal(ProgressEnvelope.paused());
            handle.context.cancel();
        }
        log.info("[Analysis] Project {} paused", projectId);
        return true;
    }

    public AnalysisStatusView status(String projectId) {
        Project project = projectPort.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        String key = ArtifactorConstants.analysisKey(projectId);
        Map<Object, Map<String, Object>> latest = new LinkedHashMap<>();
        for (ProgressEnvelope envelope : progressBus.latestEvents(key)) {
            if (envelope.event() == SseEventType.STAGE) {
                latest.put(envelope.data().get("name"), envelope.data());
            }
        }
        return new AnalysisStatusView(projectId, project.getStatus(), progressBus.hasActiveChannel(key),
                List.copyOf(latest.values()));
    }

    private RunResult execute(String projectId, RunHandle handle) {
        try {
            RunResult result = pipelineRunner.run(handle.context);
            if (result.aborted()) {
                projectPort.compareAndSetStatus(projectId, EnumSet.of(ProjectStatus.ANALYZING), ProjectStatus.ERROR);
                handle.terminal(ProgressEnvelope.error(RUN_FAILED));
            } else {
                projectPort.compareAndSetStatus(projectId, EnumSet.of(ProjectStatus.ANALYZING),
                        ProjectStatus.ANALYZED);
                handle.terminal(ProgressEnvelope.complete(result));
            }
            return result;
        } catch (CancellationException e) {
            projectPort.compareAndSetStatus(projectId, EnumSet.of(ProjectStatus.ANALYZING), ProjectStatus.PAUSED);
            handle.terminal(ProgressEnvelope.paused());
            throw e;
        } catch (RuntimeException e) {
            log.error("[Analysis] Project {} failed", projectId, e);
            projectPort.compareAndSetStatus(projectId, EnumSet.of(ProjectStatus.ANALYZING), ProjectStatus.ERROR);
            handle.terminal(ProgressEnvelope.error(RUN_FAILED));
            throw e;
        } finally {
            runs.remove(projectId, handle);
            handle.completeChannel();
        }
    }

    /**
     * Publishing side of one run. Envelopes go to the starter's unicast stream
     * and to the broadcast log in the same order.
     */
    private static final class RunHandle {

        private final Object lock = new Object();
        private final String key;
        private final ProgressEventBus<ProgressEnvelope> bus;
        private final Sinks.Many<ProgressEnvelope> primary = Sinks.many().unicast().onBackpressureBuffer();
        private final AtomicBoolean terminalSent = new AtomicBoolean(false);
        private volatile PipelineContext context;

        RunHandle(String key, ProgressEventBus<ProgressEnvelope> bus) {
            this.key = key;
            this.bus = bus;
        }

        void publish(ProgressEnvelope envelope) {
            synchronized (lock) {
                if (terminalSent.get()) {
                    return;
                }
                primary.tryEmitNext(envelope);
                bus.publish(key, envelope);
            }
        }

        void terminal(ProgressEnvelope envelope) {
            synchronized (lock) {
                if (terminalSent.compareAndSet(false, true)) {
                    primary.tryEmitNext(envelope);
                    bus.publish(key, envelope);
                }
            }
        }

        void completeChannel() {
            bus.complete(key);
        }

        void completePrimary() {
            synchronized (lock) {
                primary.tryEmitComplete();
            }
        }

        Flux<ProgressEnvelope> primaryFlux() {
            return primary.asFlux();
        }
    }
}
