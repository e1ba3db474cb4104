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

import java.util.List;

/**
 * Result of walking a model fallback chain. When no model produced an
 * acceptable reply {@code reply} and {@code model} are null and
 * {@code failures} explains each attempt.
 */
public record ModelCallOutcome(String model, ModelReply reply, List<String> failures) {

    public ModelCallOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ModelCallOutcome success(String model, ModelReply reply, List<String> failures) {
        return new ModelCallOutcome(model, reply, failures);
    }

    public static ModelCallOutcome noResult(List<String> failures) {
        return new ModelCallOutcome(null, null, failures);
    }

    public boolean hasResult() {
        return reply != null;
    }

    public String content() {
        return reply != null ? reply.content() : null;
    }
}
