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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire envelope of the analysis progress stream. Exactly one terminal
 * envelope ({@code complete}, {@code error} or {@code paused}) ends a run.
 */
public record ProgressEnvelope(SseEventType event, Map<String, Object> data) {

    public ProgressEnvelope {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ProgressEnvelope stage(StageEvent stageEvent) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", stageEvent.name());
        data.put("label", stageEvent.label());
        data.put("status", stageEvent.status().wireValue());
        data.put("message", stageEvent.message() != null ? stageEvent.message() : "");
        data.put("duration_ms", stageEvent.durationMs());
        if (stageEvent.hasProgress()) {
            data.put("completed", stageEvent.completed());
            data.put("total", stageEvent.total());
            data.put("percent", stageEvent.percent());
        }
        return new ProgressEnvelope(SseEventType.STAGE, data);
    }

    public static ProgressEnvelope complete(RunResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("project_id", result.projectId());
        data.put("sections", result.sections().size());
        data.put("stages_ok", result.stagesOk());
        data.put("stages_failed", result.stagesFailed());
        data.put("partial", result.partial());
        data.put("duration_ms", result.totalDurationMs());
        return new ProgressEnvelope(SseEventType.COMPLETE, data);
    }

    public static ProgressEnvelope error(String message) {
        return new ProgressEnvelope(SseEventType.ERROR, Map.of("message", message));
    }

    public static ProgressEnvelope paused() {
        return new ProgressEnvelope(SseEventType.PAUSED, Map.of("message", "Analysis paused"));
    }

    public boolean isTerminal() {
        return event.isTerminal();
    }
}
