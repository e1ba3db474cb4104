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

import me.golemcore.artifactor.domain.model.Citation;

import java.util.List;

/**
 * One generated documentation section.
 *
 * @param sectionName
 *            stable section identifier
 * @param title
 *            display title
 * @param content
 *            markdown body
 * @param confidence
 *            final confidence after the quality gate
 * @param citations
 *            source references backing the content
 * @param gated
 *            true when a low-confidence disclaimer was prepended
 * @param degraded
 *            true when generation failed and a placeholder was substituted
 */
public record SectionOutput(
        String sectionName,
        String title,
        String content,
        double confidence,
        List<Citation> citations,
        boolean gated,
        boolean degraded
) {

    private static final int MAX_ERROR_CHARS = 200;

    public SectionOutput {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static SectionOutput degraded(String sectionName, String title, String error) {
        String reason = error == null ? "unknown error" : error;
        if (reason.length() > MAX_ERROR_CHARS) {
            reason = reason.substring(0, MAX_ERROR_CHARS);
        }
        String content = "# " + title + "\n\n*This section could not be generated. Error: " + reason + "*\n";
        return new SectionOutput(sectionName, title, content, 0.0, List.of(), false, true);
    }
}
