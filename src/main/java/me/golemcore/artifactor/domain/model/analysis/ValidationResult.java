package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

public record ValidationResult(
        List<ValidatedEntity> entities,
        List<String> conflicts,
        int astOnlyCount,
        int llmOnlyCount,
        int crossValidatedCount
) {

    public ValidationResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static ValidationResult empty() {
        return new ValidationResult(List.of(), List.of(), 0, 0, 0);
    }
}
