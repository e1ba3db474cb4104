package me.golemcore.artifactor.domain.trace;

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

import me.golemcore.artifactor.domain.model.TraceCategory;
import me.golemcore.artifactor.domain.model.TraceEvent;
import me.golemcore.artifactor.domain.model.TraceEventType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed factories for the trace events emitted by the pipeline.
 */
public final class TraceEvents {

    private TraceEvents() {
    }

    public static String pipelineTraceId(String projectId) {
        return "pipeline_" + projectId;
    }

    public static TraceEvent pipelineStart(String traceId, Instant timestamp, String projectId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("project_id", projectId);
        return build(TraceEventType.PIPELINE_START, traceId, timestamp, TraceCategory.PIPELINE, data);
    }

    public static TraceEvent pipelineEnd(String traceId, Instant timestamp, double durationMs, boolean success) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("duration_ms", durationMs);
        data.put("success", success);
        return build(TraceEventType.PIPELINE_END, traceId, timestamp, TraceCategory.PIPELINE, data);
    }

    public static TraceEvent stageStart(String traceId, Instant timestamp, String stage, TraceCategory category) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stage", stage);
        return build(TraceEventType.STAGE_START, traceId, timestamp, category, data);
    }

    public static TraceEvent stageEnd(String traceId, Instant timestamp, String stage, double durationMs, boolean ok,
            String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stage", stage);
        data.put("duration_ms", durationMs);
        data.put("ok", ok);
        data.put("error", error);
        return build(TraceEventType.STAGE_END, traceId, timestamp, TraceCategory.PIPELINE, data);
    }

    public static TraceEvent llmCall(String traceId, Instant timestamp, String model, int inputTokens,
            int outputTokens, double durationMs, double cost) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("model", model);
        data.put("input_tokens", inputTokens);
        data.put("output_tokens", outputTokens);
        data.put("duration_ms", durationMs);
        data.put("cost", cost);
        return build(TraceEventType.LLM_CALL, traceId, timestamp, TraceCategory.LLM, data);
    }

    public static TraceEvent error(String traceId, Instant timestamp, String component, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("component", component);
        data.put("message", message);
        return build(TraceEventType.ERROR, traceId, timestamp, TraceCategory.PIPELINE, data);
    }

    private static TraceEvent build(TraceEventType type, String traceId, Instant timestamp, TraceCategory category,
            Map<String, Object> data) {
        return TraceEvent.builder()
                .type(type)
                .traceId(traceId)
                .timestamp(timestamp)
                .category(category)
                .data(data)
                .build();
    }
}
