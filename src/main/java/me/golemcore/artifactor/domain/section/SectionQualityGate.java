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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates generated section markdown. Errors fail the gate, warnings only
 * lower its score; the score is the share of checks that passed.
 */
@Component
public class SectionQualityGate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\[([A-Z][A-Z0-9_\\s]{2,30})\\]");
    private static final Pattern FENCED_CODE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern INLINE_CODE = Pattern.compile("`[^`]+`");
    private static final int MIN_REPEATED_PARAGRAPH = 50;

    private static final Set<String> KNOWN_PLACEHOLDERS = Set.of(
            "[PROJECT NAME]", "[PROJECT_NAME]", "[TODO]", "[TBD]", "[PLACEHOLDER]", "[INSERT]", "[YOUR]",
            "[EXAMPLE]", "[MODULE NAME]", "[MODULE_NAME]", "[FUNCTION NAME]", "[FUNCTION_NAME]", "[CLASS NAME]",
            "[CLASS_NAME]", "[FILE PATH]", "[FILE_PATH]", "[DESCRIPTION]", "[DETAILS]");
    private static final List<String> PLACEHOLDER_KEYWORDS = List.of(
            "TODO", "TBD", "INSERT", "YOUR", "EXAMPLE", "PLACEHOLDER");

    public enum Severity {
        ERROR, WARNING
    }

    public record GateFailure(String field, String expected, String actual, Severity severity) {
    }

    public record GateResult(String sectionName, boolean passed, double score, List<GateFailure> failures) {

        public GateResult {
            failures = failures == null ? List.of() : List.copyOf(failures);
        }
    }

    public GateResult evaluate(String sectionName, String content, SectionGateConfig config) {
        List<GateFailure> failures = new ArrayList<>();
        int totalChecks = 1;

        int length = content.strip().length();
        if (length < config.minLength()) {
            failures.add(new GateFailure("content_length", "At least " + config.minLength() + " characters",
                    length + " characters", Severity.ERROR));
        }

        if (!config.requiredHeadings().isEmpty()) {
            totalChecks++;
            String lower = content.toLowerCase(Locale.ROOT);
            List<String> missing = new ArrayList<>();
            for (String heading : config.requiredHeadings()) {
                String wanted = heading.toLowerCase(Locale.ROOT);
                if (!lower.contains("## " + wanted) && !lower.contains("### " + wanted)) {
                    missing.add(heading);
                }
            }
            if (!missing.isEmpty()) {
                failures.add(new GateFailure("required_headings",
                        "Headings present: " + String.join(", ", config.requiredHeadings()),
                        "Missing: " + String.join(", ", missing), Severity.WARNING));
            }
        }

        if (config.checkPlaceholders()) {
            totalChecks++;
            List<String> placeholders = detectPlaceholders(content);
            if (!placeholders.isEmpty()) {
                failures.add(new GateFailure("placeholders", "No unfilled placeholders",
                        placeholders.size() + " placeholder(s): "
                                + String.join(", ", placeholders.subList(0, Math.min(3, placeholders.size()))),
                        Severity.ERROR));
            }
        }

        if (config.checkRepetition()) {
            totalChecks++;
            int duplicates = countDuplicateParagraphs(content);
            if (duplicates > 0) {
                failures.add(new GateFailure("repetition", "No duplicate paragraphs",
                        duplicates + " duplicate paragraph(s)", Severity.WARNING));
            }
        }

        boolean passed = failures.stream().noneMatch(failure -> failure.severity() == Severity.ERROR);
        double score = Math.max(0.0, (double) (totalChecks - failures.size()) / totalChecks);
        return new GateResult(sectionName, passed, score, failures);
    }

    static List<String> detectPlaceholders(String content) {
        String stripped = FENCED_CODE.matcher(content).replaceAll("");
        stripped = INLINE_CODE.matcher(stripped).replaceAll("");
        List<String> found = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(stripped);
        while (matcher.find()) {
            String inner = matcher.group(1);
            String bracketed = "[" + inner + "]";
            if (KNOWN_PLACEHOLDERS.contains(bracketed) || PLACEHOLDER_KEYWORDS.stream().anyMatch(inner::contains)) {
                found.add(bracketed);
            }
        }
        return found;
    }

    private static int countDuplicateParagraphs(String content) {
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (String paragraph : content.split("\n\n")) {
            String trimmed = paragraph.strip();
            if (trimmed.length() > MIN_REPEATED_PARAGRAPH && !seen.add(trimmed)) {
                duplicates++;
            }
        }
        return duplicates;
    }
}
