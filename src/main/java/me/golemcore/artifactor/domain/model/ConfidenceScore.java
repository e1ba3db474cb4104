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

/**
 * Confidence attached to a finding.
 */
public record ConfidenceScore(double value, AnalysisSource source, String explanation) {

    public ConfidenceScore {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + value);
        }
    }
}
