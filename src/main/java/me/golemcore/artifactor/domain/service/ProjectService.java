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
import me.golemcore.artifactor.domain.exception.ProjectNotFoundException;
import me.golemcore.artifactor.domain.model.Project;
import me.golemcore.artifactor.domain.model.ProjectStatus;
import me.golemcore.artifactor.port.outbound.ProjectPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService {

    private final ProjectPort projectPort;
    private final GuardrailEvaluator guardrailEvaluator;

    public Project create(String name, String sourcePath) {
        String validName = guardrailEvaluator.validateInput(name);
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("Source path is required");
        }
        Project project = projectPort.save(Project.builder()
                .id(UUID.randomUUID().toString())
                .name(validName)
                .sourcePath(sourcePath.strip())
                .status(ProjectStatus.PENDING)
                .build());
        log.info("[Project] Created {} ({}) for {}", project.getId(), project.getName(), project.getSourcePath());
        return project;
    }

    public Project get(String projectId) {
        return projectPort.findById(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    public List<Project> list() {
        return projectPort.findAll();
    }
}
