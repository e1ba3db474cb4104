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

import me.golemcore.artifactor.domain.ArtifactorConstants;
import me.golemcore.artifactor.domain.model.AnalysisSource;
import me.golemcore.artifactor.domain.model.ConfidenceLevel;
import me.golemcore.artifactor.domain.model.ConfidenceScore;
import org.springframework.stereotype.Service;

/**
 * Deterministic confidence table for analysis findings.
 *
 * <p>
 * Deterministic parsing outranks model inference; agreement between the two
 * ranks highest and disagreement lowest:
 * <ul>
 * <li>cross-validated, high agreement - 0.95</li>
 * <li>AST only - 0.90</li>
 * <li>cross-validated, medium agreement - 0.85</li>
 * <li>LLM only - 0.70</li>
 * <li>cross-validated, low agreement - 0.50</li>
 * </ul>
 * A finding with neither source is scored as model-only. A missing agreement
 * level counts as medium.
 */
@Service
public class ConfidenceScorer {

    public ConfidenceScore score(String finding, boolean astSource, boolean llmSource) {
        return score(finding, astSource, llmSource, ConfidenceLevel.MEDIUM);
    }

    public ConfidenceScore score(String finding, boolean astSource, boolean llmSource, ConfidenceLevel agreement) {
        if (astSource && llmSource) {
            ConfidenceLevel level = agreement != null ? agreement : ConfidenceLevel.MEDIUM;
            return switch (level) {
            case HIGH -> new ConfidenceScore(ArtifactorConstants.CONFIDENCE_CROSS_VALIDATED_HIGH,
                    AnalysisSource.CROSS_VALIDATED, "Cross-validated: AST and LLM agree on '" + finding + "'");
            case MEDIUM -> new ConfidenceScore(ArtifactorConstants.CONFIDENCE_CROSS_VALIDATED_MEDIUM,
                    AnalysisSource.CROSS_VALIDATED, "Partial agreement on '" + finding + "'");
            case LOW -> new ConfidenceScore(ArtifactorConstants.CONFIDENCE_CROSS_VALIDATED_LOW,
                    AnalysisSource.CROSS_VALIDATED, "AST and LLM disagree on '" + finding + "'");
            };
        }
        if (astSource) {
            return new ConfidenceScore(ArtifactorConstants.CONFIDENCE_AST_ONLY, AnalysisSource.AST,
                    "AST-derived (deterministic): '" + finding + "'");
        }
        return new ConfidenceScore(ArtifactorConstants.CONFIDENCE_LLM_ONLY, AnalysisSource.LLM,
                "LLM-inferred (probabilistic): '" + finding + "'");
    }

    /**
     * Combine a section's base confidence with its quality gate score, clamped
     * to the configured floor and ceiling.
     */
    public double adjustForGate(double baseConfidence, double gateScore) {
        double confidence = baseConfidence * gateScore;
        return Math.max(ArtifactorConstants.CONFIDENCE_FLOOR,
                Math.min(ArtifactorConstants.CONFIDENCE_CEILING, confidence));
    }
}
