package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

public record ChunkedFiles(List<CodeChunk> chunks, int totalFiles, int totalLines) {

    public ChunkedFiles {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static ChunkedFiles empty() {
        return new ChunkedFiles(List.of(), 0, 0);
    }
}
