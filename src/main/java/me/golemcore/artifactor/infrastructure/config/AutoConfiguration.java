package me.golemcore.artifactor.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.model.ProgressEnvelope;
import me.golemcore.artifactor.domain.pipeline.PipelineExecutors;
import me.golemcore.artifactor.domain.service.ProgressEventBus;
import me.golemcore.artifactor.domain.service.TraceDispatcher;
import me.golemcore.artifactor.port.outbound.TraceHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ArtifactorProperties properties;
    private final List<ExecutorService> executors = new ArrayList<>();

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public PipelineExecutors pipelineExecutors() {
        ArtifactorProperties.ExecutorProperties config = properties.getExecutor();
        PipelineExecutors pipelineExecutors = new PipelineExecutors(
                track(Executors.newFixedThreadPool(config.getRunThreads(), named("analysis-run"))),
                track(Executors.newFixedThreadPool(config.getStageThreads(), named("analysis-stage"))),
                track(Executors.newFixedThreadPool(config.getParseThreads(), named("analysis-parse"))));
        log.info("[Config] Executors: run={}, stage={}, parse={}", config.getRunThreads(), config.getStageThreads(),
                config.getParseThreads());
        return pipelineExecutors;
    }

    /**
     * Dispatcher with the handlers enabled by {@code artifactor.trace.handlers}.
     */
    @Bean
    public TraceDispatcher traceDispatcher(List<TraceHandler> availableHandlers) {
        TraceDispatcher dispatcher = new TraceDispatcher();
        ArtifactorProperties.TraceProperties trace = properties.getTrace();
        if (!trace.isEnabled()) {
            log.info("[Trace] Tracing disabled");
            return dispatcher;
        }
        for (String name : trace.getHandlers()) {
            availableHandlers.stream()
                    .filter(handler -> handler.getName().equals(name))
                    .findFirst()
                    .ifPresentOrElse(dispatcher::register,
                            () -> log.warn("[Trace] Unknown trace handler '{}', skipping", name));
        }
        log.info("[Trace] {} handler(s) registered", dispatcher.handlerCount());
        return dispatcher;
    }

    @Bean
    public ProgressEventBus<ProgressEnvelope> progressEventBus(Clock clock) {
        return new ProgressEventBus<>(properties.getProgress().getRetention(), clock);
    }

    @PostConstruct
    public void init() {
        log.info("Artifactor starting...");
        log.info("Model chain: {}", properties.getModels().getChain());
        log.info("Sections: {}", properties.getAnalysis().getSections());
    }

    @PreDestroy
    public void shutdown() {
        synchronized (executors) {
            executors.forEach(ExecutorService::shutdownNow);
        }
    }

    private ExecutorService track(ExecutorService executor) {
        synchronized (executors) {
            executors.add(executor);
        }
        return executor;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
