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

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import me.golemcore.artifactor.adapter.inbound.web.dto.CreateProjectRequest;
import me.golemcore.artifactor.domain.model.Project;
import me.golemcore.artifactor.domain.model.RunResult;
import me.golemcore.artifactor.domain.service.ProjectService;
import me.golemcore.artifactor.port.outbound.AnalysisStorePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectsController {

    private final ProjectService projectService;
    private final ObjectProvider<AnalysisStorePort> analysisStore;

    @PostMapping
    public Mono<ResponseEntity<Project>> create(@Valid @RequestBody CreateProjectRequest request) {
        Project project = projectService.create(request.getName(), request.getSourcePath());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(project));
    }

    @GetMapping
    public Mono<ResponseEntity<List<Project>>> list() {
        return Mono.just(ResponseEntity.ok(projectService.list()));
    }

    @GetMapping("/{projectId}")
    public Mono<ResponseEntity<Project>> get(@PathVariable String projectId) {
        return Mono.just(ResponseEntity.ok(projectService.get(projectId)));
    }

    @GetMapping("/{projectId}/result")
    public Mono<ResponseEntity<RunResult>> latestResult(@PathVariable String projectId) {
        projectService.get(projectId);
        AnalysisStorePort store = analysisStore.getIfAvailable();
        if (store == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(store.findLatest(projectId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
