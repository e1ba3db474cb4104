package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

public record ParsedSources(List<ParsedFile> files) {

    public ParsedSources {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static ParsedSources empty() {
        return new ParsedSources(List.of());
    }

    public List<CodeEntity> entities() {
        return files.stream().flatMap(file -> file.entities().stream()).toList();
    }
}
