package me.golemcore.artifactor.domain.model;

/**
 * Origin of a finding's confidence.
 */
public enum AnalysisSource {
    AST, LLM, CROSS_VALIDATED
}
