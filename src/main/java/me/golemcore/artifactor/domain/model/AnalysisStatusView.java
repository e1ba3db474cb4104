package me.golemcore.artifactor.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Latest known state of each stage of a project's current or last run.
 */
public record AnalysisStatusView(
        @JsonProperty("project_id") String projectId,
        ProjectStatus status,
        boolean running,
        List<Map<String, Object>> stages
) {

    public AnalysisStatusView {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }
}
