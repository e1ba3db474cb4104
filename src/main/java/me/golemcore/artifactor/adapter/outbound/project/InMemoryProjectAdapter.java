package me.golemcore.artifactor.adapter.outbound.project;

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
import me.golemcore.artifactor.domain.model.Project;
import me.golemcore.artifactor.domain.model.ProjectStatus;
import me.golemcore.artifactor.port.outbound.ProjectPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Project registry kept in memory. Records are copied on the way in and out so
 * callers never share mutable state with the registry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryProjectAdapter implements ProjectPort {

    private final Clock clock;
    private final Map<String, Project> projects = new HashMap<>();
    private final Object lock = new Object();

    @Override
    public Project save(Project project) {
        synchronized (lock) {
            Instant now = Instant.now(clock);
            Project stored = copy(project);
            if (stored.getCreatedAt() == null) {
                stored.setCreatedAt(now);
            }
            stored.setUpdatedAt(now);
            projects.put(stored.getId(), stored);
            return copy(stored);
        }
    }

    @Override
    public Optional<Project> findById(String projectId) {
        synchronized (lock) {
            return Optional.ofNullable(projects.get(projectId)).map(InMemoryProjectAdapter::copy);
        }
    }

    @Override
    public List<Project> findAll() {
        synchronized (lock) {
            List<Project> all = new ArrayList<>();
            projects.values().forEach(project -> all.add(copy(project)));
            all.sort(Comparator.comparing(Project::getCreatedAt));
            return all;
        }
    }

    @Override
    public boolean compareAndSetStatus(String projectId, Set<ProjectStatus> expected, ProjectStatus next) {
        synchronized (lock) {
            Project project = projects.get(projectId);
            if (project == null || !expected.contains(project.getStatus())) {
                return false;
            }
            log.debug("[Project] {} status {} -> {}", projectId, project.getStatus(), next);
            project.setStatus(next);
            project.setUpdatedAt(Instant.now(clock));
            return true;
        }
    }

    @Override
    public void updateStatus(String projectId, ProjectStatus status) {
        synchronized (lock) {
            Project project = projects.get(projectId);
            if (project != null) {
                project.setStatus(status);
                project.setUpdatedAt(Instant.now(clock));
            }
        }
    }

    private static Project copy(Project project) {
        return Project.builder()
                .id(project.getId())
                .name(project.getName())
                .sourcePath(project.getSourcePath())
                .status(project.getStatus())
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .build();
    }
}
