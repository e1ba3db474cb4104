package me.golemcore.artifactor.port.outbound;

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

import me.golemcore.artifactor.domain.model.Project;
import me.golemcore.artifactor.domain.model.ProjectStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Port for project records.
 */
public interface ProjectPort {

    Project save(Project project);

    Optional<Project> findById(String projectId);

    List<Project> findAll();

    /**
     * Atomically move a project to {@code next} if its current status is one of
     * {@code expected}.
     *
     * @return true if the status was changed
     */
    boolean compareAndSetStatus(String projectId, Set<ProjectStatus> expected, ProjectStatus next);

    /**
     * Unconditionally set the status of a project.
     */
    void updateStatus(String projectId, ProjectStatus status);
}
