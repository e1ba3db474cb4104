package me.golemcore.artifactor.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.exception.GuardrailViolationException;
import me.golemcore.artifactor.domain.model.Citation;
import me.golemcore.artifactor.domain.model.GuardrailResult;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Guardrails applied to generated output and user input: citation
 * verification against the source tree, input sanitation and low-confidence
 * gating.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuardrailEvaluator {

    public static final String CHECK_FILE_EXISTS = "citation_file_exists";
    public static final String CHECK_LINE_START = "citation_line_start";
    public static final String CHECK_LINE_RANGE = "citation_line_range";
    public static final String CHECK_FILE_READABLE = "citation_file_readable";
    public static final String CHECK_LINE_END = "citation_line_end";
    public static final String CHECK_VALID = "citation_valid";
    public static final String CHECK_INPUT = "input_not_empty";

    private final SourceAccessPort sourceAccess;
    private final ArtifactorProperties properties;

    /**
     * Verify each citation against the tree under {@code root}. Produces exactly
     * one result per citation, in input order. Checks run in a fixed order and
     * the first failing check decides the result.
     */
    public List<GuardrailResult> verifyCitations(List<Citation> citations, Path root) {
        List<GuardrailResult> results = new ArrayList<>(citations.size());
        for (Citation citation : citations) {
            results.add(verifyCitation(citation, root));
        }
        long failed = results.stream().filter(result -> !result.passed()).count();
        if (failed > 0) {
            log.debug("[Guardrail] {} of {} citations failed verification", failed, citations.size());
        }
        return results;
    }

    public GuardrailResult verifyCitation(Citation citation, Path root) {
        String location = citation.location();

        if (!sourceAccess.fileExists(root, citation.filePath())) {
            return GuardrailResult.fail(CHECK_FILE_EXISTS, "File not found: " + citation.filePath());
        }
        if (citation.lineStart() < 1) {
            return GuardrailResult.fail(CHECK_LINE_START, "line_start < 1 in " + location);
        }
        if (citation.lineEnd() < citation.lineStart()) {
            return GuardrailResult.fail(CHECK_LINE_RANGE, "line_end < line_start in " + location);
        }

        int lineCount;
        try {
            lineCount = sourceAccess.countLines(root, citation.filePath());
        } catch (UncheckedIOException e) {
            log.debug("[Guardrail] Cannot read {}: {}", citation.filePath(), e.getMessage());
            return GuardrailResult.fail(CHECK_FILE_READABLE, "Cannot read file: " + citation.filePath());
        }

        if (citation.lineEnd() > lineCount) {
            return GuardrailResult.fail(CHECK_LINE_END, "line_end (" + citation.lineEnd()
                    + ") exceeds file length (" + lineCount + ") in " + location);
        }
        return GuardrailResult.pass(CHECK_VALID);
    }

    /**
     * Trim user input and enforce the length limit. Over-long input is truncated
     * rather than rejected.
     *
     * @throws GuardrailViolationException
     *             if the input is empty after trimming
     */
    public String validateInput(String input) {
        String cleaned = input == null ? "" : input.strip();
        if (cleaned.isEmpty()) {
            throw new GuardrailViolationException(CHECK_INPUT, "Input is empty");
        }
        int maxLength = properties.getGuardrails().getMaxInputLength();
        if (cleaned.length() > maxLength) {
            log.debug("[Guardrail] Input truncated from {} to {} characters", cleaned.length(), maxLength);
            cleaned = cleaned.substring(0, maxLength);
        }
        return cleaned;
    }

    public GatedOutput gateLowConfidence(String content, double confidence) {
        return gateLowConfidence(content, confidence, properties.getGuardrails().getLowConfidenceThreshold());
    }

    /**
     * Prefix content with a visible disclaimer when its confidence is below the
     * threshold.
     */
    public GatedOutput gateLowConfidence(String content, double confidence, double threshold) {
        if (confidence >= threshold) {
            return new GatedOutput(content, false);
        }
        String disclaimer = String.format(Locale.ROOT, "[Low confidence: %.2f] ", confidence);
        return new GatedOutput(disclaimer + content, true);
    }

    public record GatedOutput(String content, boolean gated) {
    }
}
