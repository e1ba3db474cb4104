package me.golemcore.artifactor.domain.analysis;

import me.golemcore.artifactor.domain.model.analysis.ApiEndpoints;
import me.golemcore.artifactor.domain.model.analysis.CallGraph;
import me.golemcore.artifactor.domain.model.analysis.DependencyGraph;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructureExtractorsTest {

    private ParsedSources sources;

    @BeforeEach
    void setUp() {
        RegexSourceParser parser = new RegexSourceParser();
        sources = new ParsedSources(List.of(
                parser.parse("app/service.py", "python", List.of(
                        "import os",
                        "from app.models import User",
                        "",
                        "def get_user(id):",
                        "    return find_user(id)",
                        "",
                        "def find_user(id):",
                        "    return User(id)")),
                parser.parse("app/models.py", "python", List.of(
                        "class User:",
                        "    id: int",
                        "    name: str")),
                parser.parse("web/routes.js", "javascript", List.of(
                        "const router = require('express').Router();",
                        "router.get('/users', listUsers);",
                        "router.post('/users', createUser);")),
                parser.parse("src/Api.java", "java", List.of(
                        "public class Api {",
                        "    @GetMapping(\"/api/health\")",
                        "    public String health() {",
                        "        return \"ok\";",
                        "    }",
                        "}"))));
    }

    @Test
    void shouldLinkCallsToKnownFunctions() {
        CallGraph graph = new CallGraphExtractor().extract(sources);

        assertEquals(List.of(new CallGraph.Edge("get_user", "find_user", "app/service.py", 5)), graph.edges());
    }

    @Test
    void shouldMarkInternalImports() {
        DependencyGraph graph = new DependencyGraphExtractor().extract(sources);

        assertTrue(graph.edges().contains(new DependencyGraph.Edge("app/service.py", "app.models", true)));
        assertTrue(graph.edges().contains(new DependencyGraph.Edge("app/service.py", "os", false)));
        assertTrue(graph.edges().contains(new DependencyGraph.Edge("web/routes.js", "express", false)));
    }

    @Test
    void shouldExtractClassFields() {
        SchemaMap schemas = new SchemaExtractor().extract(sources);

        assertEquals(1, schemas.schemas().size());
        SchemaMap.Schema user = schemas.schemas().get(0);
        assertEquals("User", user.name());
        assertEquals(List.of("id", "name"), user.fields());
    }

    @Test
    void shouldFindRouterAndSpringEndpoints() {
        ApiEndpoints endpoints = new ApiEndpointExtractor().extract(sources);

        assertEquals(List.of(
                new ApiEndpoints.Endpoint("GET", "/users", "web/routes.js", 2),
                new ApiEndpoints.Endpoint("POST", "/users", "web/routes.js", 3),
                new ApiEndpoints.Endpoint("GET", "/api/health", "src/Api.java", 2)), endpoints.endpoints());
    }

    @Test
    void shouldDeriveModuleNameFromPath() {
        assertEquals("app.models", DependencyGraphExtractor.moduleName("app/models.py"));
        assertEquals("src.main", DependencyGraphExtractor.moduleName("src\\Main"));
    }
}
