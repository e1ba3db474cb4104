package me.golemcore.artifactor.adapter.inbound.web.controller;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.adapter.inbound.web.dto.PauseResponse;
import me.golemcore.artifactor.domain.exception.ArtifactorException;
import me.golemcore.artifactor.domain.model.AnalysisStatusView;
import me.golemcore.artifactor.domain.model.ProgressEnvelope;
import me.golemcore.artifactor.domain.service.AnalysisService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Analysis lifecycle endpoints. Progress is streamed as server-sent events
 * named after the envelope type ({@code stage}, {@code complete},
 * {@code error}, {@code paused}) with the envelope data as JSON.
 */
@RestController
@RequestMapping("/api/projects/{projectId}")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final AnalysisService analysisService;
    private final ObjectMapper objectMapper;

    @PostMapping(value = "/analyze", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> analyze(@PathVariable String projectId) {
        log.info("[API] Analysis requested for project {}", projectId);
        return analysisService.analyze(projectId).map(this::toEvent);
    }

    @PostMapping("/pause")
    public Mono<ResponseEntity<PauseResponse>> pause(@PathVariable String projectId) {
        boolean paused = analysisService.pause(projectId);
        return Mono.just(ResponseEntity.ok(PauseResponse.builder()
                .projectId(projectId)
                .paused(paused)
                .build()));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<AnalysisStatusView>> status(@PathVariable String projectId) {
        return Mono.just(ResponseEntity.ok(analysisService.status(projectId)));
    }

    ServerSentEvent<String> toEvent(ProgressEnvelope envelope) {
        try {
            return ServerSentEvent.<String>builder()
                    .event(envelope.event().wireValue())
                    .data(objectMapper.writeValueAsString(envelope.data()))
                    .build();
        } catch (JsonProcessingException e) {
            throw new ArtifactorException("Failed to serialize progress event", e);
        }
    }
}
