package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

public record ApiEndpoints(List<Endpoint> endpoints) {

    public record Endpoint(String method, String path, String filePath, int line) {
    }

    public ApiEndpoints {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    }

    public static ApiEndpoints empty() {
        return new ApiEndpoints(List.of());
    }
}
