package me.golemcore.artifactor.domain.pipeline;

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

/**
 * A named unit of work in an analysis run.
 *
 * <p>
 * A stage reads what earlier stages put into the {@link PipelineContext} and
 * returns its own result. If the body throws, the runner records the failure
 * and substitutes {@link #defaultResult()} so later stages can continue.
 *
 * @param <T>
 *            result type
 */
public interface PipelineStage<T> {

    /**
     * Stable stage identifier used in events and statuses.
     */
    String getName();

    T execute(PipelineContext context);

    /**
     * Result used when the body fails. Null means no usable default.
     */
    default T defaultResult() {
        return null;
    }

    default TraceCategory getCategory() {
        return TraceCategory.PIPELINE;
    }

    /**
     * Message of the running event.
     */
    default String describe(PipelineContext context) {
        return "";
    }

    /**
     * Message of the done event.
     */
    default String summarize(T result) {
        return "";
    }
}
