package me.golemcore.artifactor.domain;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Stage identifiers, display labels and confidence constants shared by the
 * pipeline and the web layer.
 *
 * <p>
 * Stage names are stable identifiers used in events and stored statuses;
 * labels are user-facing and may change.
 */
public final class ArtifactorConstants {

    public static final String STAGE_INGESTION_RESOLVE = "ingestion_resolve";
    public static final String STAGE_INGESTION_DETECT = "ingestion_detect";
    public static final String STAGE_INGESTION_CHUNK = "ingestion_chunk";
    public static final String STAGE_STATIC_ANALYSIS = "static_analysis";
    public static final String STAGE_LLM_ANALYSIS = "llm_analysis";
    public static final String STAGE_DUAL_ANALYSIS = "dual_analysis";
    public static final String STAGE_QUALITY = "quality";
    public static final String STAGE_INTELLIGENCE_MODEL = "intelligence_model";
    public static final String STAGE_SECTION_GENERATION = "section_generation";
    public static final String STAGE_CITATION_VERIFICATION = "citation_verification";
    public static final String STAGE_PERSISTENCE = "persistence";
    public static final String SECTION_STAGE_PREFIX = "generate_";

    /**
     * Stages whose failure aborts the run.
     */
    public static final Set<String> FOUNDATIONAL_STAGES = Set.of(STAGE_INGESTION_RESOLVE, STAGE_INTELLIGENCE_MODEL);

    public static final double CONFIDENCE_CROSS_VALIDATED_HIGH = 0.95;
    public static final double CONFIDENCE_AST_ONLY = 0.90;
    public static final double CONFIDENCE_CROSS_VALIDATED_MEDIUM = 0.85;
    public static final double CONFIDENCE_LLM_ONLY = 0.70;
    public static final double CONFIDENCE_CROSS_VALIDATED_LOW = 0.50;
    public static final double CONFIDENCE_FLOOR = 0.10;
    public static final double CONFIDENCE_CEILING = 0.95;
    public static final double CONFIDENCE_SECTION_RICH = 0.90;
    public static final double CONFIDENCE_SECTION_SPARSE = 0.80;
    public static final double CONFIDENCE_SECTION_TEMPLATE = 0.50;

    public static final String ANALYSIS_KEY_PREFIX = "analyze:";

    private static final Map<String, String> STAGE_LABELS = new LinkedHashMap<>();

    static {
        STAGE_LABELS.put(STAGE_INGESTION_RESOLVE, "Scanning codebase");
        STAGE_LABELS.put(STAGE_INGESTION_DETECT, "Detecting languages");
        STAGE_LABELS.put(STAGE_INGESTION_CHUNK, "Splitting source files");
        STAGE_LABELS.put(STAGE_STATIC_ANALYSIS, "Parsing code structure");
        STAGE_LABELS.put(STAGE_LLM_ANALYSIS, "AI analysis");
        STAGE_LABELS.put(STAGE_DUAL_ANALYSIS, "Cross-validating findings");
        STAGE_LABELS.put(STAGE_QUALITY, "Scoring confidence");
        STAGE_LABELS.put(STAGE_INTELLIGENCE_MODEL, "Building Intelligence Model");
        STAGE_LABELS.put(STAGE_SECTION_GENERATION, "Generating documentation");
        STAGE_LABELS.put(STAGE_CITATION_VERIFICATION, "Verifying citations");
        STAGE_LABELS.put(STAGE_PERSISTENCE, "Saving results");
    }

    private ArtifactorConstants() {
    }

    /**
     * Resolve the display label of a stage. Per-section stages are labelled
     * after their section; unknown names are returned unchanged.
     */
    public static String stageLabel(String stageName) {
        if (stageName == null) {
            return "";
        }
        String label = STAGE_LABELS.get(stageName);
        if (label != null) {
            return label;
        }
        if (stageName.startsWith(SECTION_STAGE_PREFIX)) {
            return "Generating " + stageName.substring(SECTION_STAGE_PREFIX.length()).replace('_', ' ');
        }
        return stageName;
    }

    public static boolean isFoundational(String stageName) {
        return FOUNDATIONAL_STAGES.contains(stageName);
    }

    public static String analysisKey(String projectId) {
        return ANALYSIS_KEY_PREFIX + projectId;
    }
}
