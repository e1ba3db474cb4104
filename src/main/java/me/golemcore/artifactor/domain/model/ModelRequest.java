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

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

/**
 * A model call to be attempted against each model of a fallback chain.
 *
 * @param purpose
 *            short tag used in logs and trace events
 * @param traceId
 *            trace the resulting llm_call events belong to, may be null
 * @param messages
 *            conversation sent to the model
 * @param timeout
 *            per-attempt timeout
 * @param mode
 *            expected reply shape
 * @param minLength
 *            minimum accepted length of the trimmed reply
 * @param validator
 *            optional extra acceptance check on the trimmed reply
 */
@Builder
public record ModelRequest(
        String purpose,
        String traceId,
        List<ModelMessage> messages,
        Duration timeout,
        ResponseMode mode,
        int minLength,
        Predicate<String> validator
) {

    public ModelRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        mode = mode == null ? ResponseMode.TEXT : mode;
        timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
    }
}
