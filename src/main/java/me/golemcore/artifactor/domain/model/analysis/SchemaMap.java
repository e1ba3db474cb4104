package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

public record SchemaMap(List<Schema> schemas) {

    public record Schema(String name, String filePath, int line, List<String> fields) {

        public Schema {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }

    public SchemaMap {
        schemas = schemas == null ? List.of() : List.copyOf(schemas);
    }

    public static SchemaMap empty() {
        return new SchemaMap(List.of());
    }
}
