package me.golemcore.artifactor.domain.model;

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

import lombok.Builder;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.QualityReport;
import me.golemcore.artifactor.domain.model.analysis.SectionOutput;

import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * <p>
 * {@code partial} is set when a non-foundational stage failed and its default
 * was substituted; {@code aborted} when a foundational stage failed and the run
 * stopped early.
 */
@Builder
public record RunResult(
        String projectId,
        List<StageStatus> stages,
        boolean partial,
        boolean aborted,
        List<SectionOutput> sections,
        IntelligenceModel model,
        QualityReport qualityReport,
        double totalDurationMs
) {

    public RunResult {
        stages = stages == null ? List.of() : List.copyOf(stages);
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public long stagesOk() {
        return stages.stream().filter(StageStatus::ok).count();
    }

    public long stagesFailed() {
        return stages.stream().filter(status -> !status.ok()).count();
    }
}
