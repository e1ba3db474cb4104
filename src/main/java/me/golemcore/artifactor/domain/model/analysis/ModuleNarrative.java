package me.golemcore.artifactor.domain.model.analysis;

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

import me.golemcore.artifactor.domain.model.ConfidenceLevel;

import java.util.List;

/**
 * Model-produced description of one code chunk.
 */
public record ModuleNarrative(
        String filePath,
        String purpose,
        List<String> behaviors,
        ConfidenceLevel confidence
) {

    public static final String UNAVAILABLE_PURPOSE = "Analysis unavailable";

    public ModuleNarrative {
        behaviors = behaviors == null ? List.of() : List.copyOf(behaviors);
        confidence = confidence == null ? ConfidenceLevel.LOW : confidence;
    }

    public static ModuleNarrative unavailable(String filePath) {
        return new ModuleNarrative(filePath, UNAVAILABLE_PURPOSE, List.of(), ConfidenceLevel.LOW);
    }

    public boolean isAvailable() {
        return !UNAVAILABLE_PURPOSE.equals(purpose);
    }
}
