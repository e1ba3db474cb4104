package me.golemcore.artifactor.domain.section;

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
import java.util.Map;

/**
 * Quality thresholds for one section type.
 *
 * @param minLength
 *            minimum trimmed content length
 * @param requiredHeadings
 *            headings that must appear at level two or three
 * @param checkPlaceholders
 *            reject unfilled template placeholders
 * @param checkRepetition
 *            flag duplicated paragraphs
 */
public record SectionGateConfig(
        int minLength,
        List<String> requiredHeadings,
        boolean checkPlaceholders,
        boolean checkRepetition
) {

    public static final SectionGateConfig DEFAULT = of(200);

    private static final Map<String, SectionGateConfig> BY_SECTION = Map.ofEntries(
            Map.entry("executive_overview", of(300)),
            Map.entry("features", of(200, "Feature Areas")),
            Map.entry("system_overview", of(200, "Architecture Diagram")),
            Map.entry("data_models", of(100)),
            Map.entry("api_specs", of(100)),
            Map.entry("user_stories", of(200)),
            Map.entry("tech_stories", of(200)),
            Map.entry("security_requirements", of(100)),
            Map.entry("security_considerations", of(200, "Coverage Summary")),
            Map.entry("integrations", of(100)),
            Map.entry("interfaces", of(100)),
            Map.entry("personas", of(100)),
            Map.entry("ui_specs", of(50)));

    public SectionGateConfig {
        requiredHeadings = requiredHeadings == null ? List.of() : List.copyOf(requiredHeadings);
    }

    public static SectionGateConfig of(int minLength, String... requiredHeadings) {
        return new SectionGateConfig(minLength, List.of(requiredHeadings), true, true);
    }

    public static SectionGateConfig forSection(String sectionName) {
        return BY_SECTION.getOrDefault(sectionName, DEFAULT);
    }
}
