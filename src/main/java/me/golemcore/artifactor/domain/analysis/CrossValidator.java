package me.golemcore.artifactor.domain.analysis;

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
import me.golemcore.artifactor.domain.model.ConfidenceLevel;
import me.golemcore.artifactor.domain.model.ConfidenceScore;
import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.LlmAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ModuleNarrative;
import me.golemcore.artifactor.domain.model.analysis.StaticAnalysisResult;
import me.golemcore.artifactor.domain.model.analysis.ValidatedEntity;
import me.golemcore.artifactor.domain.model.analysis.ValidationResult;
import me.golemcore.artifactor.domain.service.ConfidenceScorer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reconciles AST entities with model narratives. An entity is cross-validated
 * when every token of its name appears in one behavior described for the same
 * file. The AST wins when the two disagree.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrossValidator {

    static final String NO_AGREEMENT_CONFLICT =
            "No cross-validated entities found despite both analysis paths producing results";

    private static final Pattern TOKEN = Pattern.compile("[A-Z]?[a-z]+|[A-Z]+(?=[A-Z]|$)|[a-z]+|\\d+");
    private static final int MAX_FINDING_CHARS = 80;

    private final ConfidenceScorer confidenceScorer;

    public ValidationResult validate(StaticAnalysisResult staticAnalysis, LlmAnalysisResult llmAnalysis) {
        Map<String, CodeEntity> astEntities = new LinkedHashMap<>();
        for (CodeEntity entity : staticAnalysis.parsed().entities()) {
            astEntities.putIfAbsent(entity.name() + "\0" + entity.filePath(), entity);
        }

        Map<String, List<Set<String>>> behaviorsByFile = new HashMap<>();
        List<ModuleNarrative> available = new ArrayList<>();
        for (ModuleNarrative narrative : llmAnalysis.narratives()) {
            if (!narrative.isAvailable()) {
                continue;
            }
            available.add(narrative);
            for (String behavior : narrative.behaviors()) {
                behaviorsByFile.computeIfAbsent(narrative.filePath(), key -> new ArrayList<>()).add(tokenize(behavior));
            }
        }

        List<ValidatedEntity> validated = new ArrayList<>();
        Set<String> filesWithEntities = new HashSet<>();
        int crossValidated = 0;
        int astOnly = 0;
        for (CodeEntity entity : astEntities.values()) {
            filesWithEntities.add(entity.filePath());
            Set<String> tokens = tokenize(entity.name());
            boolean confirmed = !tokens.isEmpty() && behaviorsByFile.getOrDefault(entity.filePath(), List.of())
                    .stream()
                    .anyMatch(behaviorTokens -> behaviorTokens.containsAll(tokens));
            ConfidenceScore score = confirmed
                    ? confidenceScorer.score(entity.name(), true, true, ConfidenceLevel.HIGH)
                    : confidenceScorer.score(entity.name(), true, false);
            validated.add(new ValidatedEntity(entity.name(), entity.type().name().toLowerCase(Locale.ROOT),
                    entity.filePath(), entity.startLine(), score));
            if (confirmed) {
                crossValidated++;
            } else {
                astOnly++;
            }
        }

        int llmOnly = 0;
        for (ModuleNarrative narrative : available) {
            if (filesWithEntities.contains(narrative.filePath())) {
                continue;
            }
            String finding = truncate(narrative.purpose());
            validated.add(new ValidatedEntity(finding, "module_purpose", narrative.filePath(), 0,
                    confidenceScorer.score(finding, false, true)));
            llmOnly++;
        }

        List<String> conflicts = new ArrayList<>();
        if (crossValidated == 0 && !astEntities.isEmpty() && !available.isEmpty()) {
            conflicts.add(NO_AGREEMENT_CONFLICT);
        }
        log.info("[Quality] {} cross-validated, {} AST-only, {} LLM-only findings", crossValidated, astOnly,
                llmOnly);
        return new ValidationResult(validated, conflicts, astOnly, llmOnly, crossValidated);
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= 2) {
                tokens.add(token.toLowerCase(Locale.ROOT));
            }
        }
        return tokens;
    }

    private static String truncate(String text) {
        return text.length() > MAX_FINDING_CHARS ? text.substring(0, MAX_FINDING_CHARS) : text;
    }
}
