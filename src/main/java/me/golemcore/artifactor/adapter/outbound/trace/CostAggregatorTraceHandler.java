package me.golemcore.artifactor.adapter.outbound.trace;

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

import me.golemcore.artifactor.domain.model.TraceEvent;
import me.golemcore.artifactor.domain.model.TraceEventType;
import me.golemcore.artifactor.port.outbound.TraceHandler;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accumulates model token usage and estimated cost per trace from
 * {@code llm_call} events.
 */
@Component
public class CostAggregatorTraceHandler implements TraceHandler {

    public static final String NAME = "cost_aggregator";

    private final Map<String, TraceCost> costs = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public CompletableFuture<Void> handle(TraceEvent event) {
        if (event.type() != TraceEventType.LLM_CALL) {
            return CompletableFuture.completedFuture(null);
        }
        TraceCost delta = new TraceCost(
                toLong(event.data().get("input_tokens")),
                toLong(event.data().get("output_tokens")),
                toDouble(event.data().get("cost")),
                1);
        costs.merge(event.traceId(), delta, TraceCost::plus);
        return CompletableFuture.completedFuture(null);
    }

    public TraceCost getCost(String traceId) {
        return costs.getOrDefault(traceId, TraceCost.ZERO);
    }

    public Map<String, TraceCost> allCosts() {
        return Map.copyOf(costs);
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static double toDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }

    public record TraceCost(long inputTokens, long outputTokens, double totalCost, int callCount) {

        public static final TraceCost ZERO = new TraceCost(0, 0, 0.0, 0);

        TraceCost plus(TraceCost other) {
            return new TraceCost(inputTokens + other.inputTokens, outputTokens + other.outputTokens,
                    totalCost + other.totalCost, callCount + other.callCount);
        }
    }
}
