package me.golemcore.artifactor.domain.analysis;

import me.golemcore.artifactor.domain.model.analysis.DependencyGraph;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * File-level import graph. An import is internal when it is relative or names a
 * module that exists in the parsed tree.
 */
@Component
public class DependencyGraphExtractor implements StructureExtractor<DependencyGraph> {

    @Override
    public String getName() {
        return "dependency_graph";
    }

    @Override
    public DependencyGraph extract(ParsedSources sources) {
        Set<String> modules = new HashSet<>();
        for (ParsedFile file : sources.files()) {
            modules.add(moduleName(file.filePath()));
        }

        List<DependencyGraph.Edge> edges = new ArrayList<>();
        for (ParsedFile file : sources.files()) {
            for (String target : file.imports()) {
                edges.add(new DependencyGraph.Edge(file.filePath(), target, isInternal(target, modules)));
            }
        }
        return new DependencyGraph(edges);
    }

    @Override
    public DependencyGraph emptyResult() {
        return DependencyGraph.empty();
    }

    static String moduleName(String filePath) {
        String normalized = filePath.replace('\\', '/');
        int dot = normalized.lastIndexOf('.');
        if (dot > normalized.lastIndexOf('/')) {
            normalized = normalized.substring(0, dot);
        }
        return normalized.replace('/', '.').toLowerCase(Locale.ROOT);
    }

    private static boolean isInternal(String target, Set<String> modules) {
        if (target.startsWith(".")) {
            return true;
        }
        String normalized = target.replace("::", ".").replace('/', '.').replace(".*", "").toLowerCase(Locale.ROOT);
        for (String module : modules) {
            if (module.equals(normalized) || module.endsWith("." + normalized)) {
                return true;
            }
        }
        return false;
    }
}
