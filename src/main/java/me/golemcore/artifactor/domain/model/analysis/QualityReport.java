package me.golemcore.artifactor.domain.model.analysis;

import me.golemcore.artifactor.domain.model.GuardrailResult;

import java.util.List;

public record QualityReport(List<GuardrailResult> results, int citationsChecked, int citationsValid,
        double avgConfidence) {

    public QualityReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public double citationAccuracy() {
        return citationsChecked == 0 ? 1.0 : (double) citationsValid / citationsChecked;
    }
}
