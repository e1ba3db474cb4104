package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

/**
 * Per-language statistics of a source tree.
 */
public record LanguageInfo(String name, int fileCount, int lineCount, List<String> extensions) {

    public LanguageInfo {
        extensions = extensions == null ? List.of() : List.copyOf(extensions);
    }
}
