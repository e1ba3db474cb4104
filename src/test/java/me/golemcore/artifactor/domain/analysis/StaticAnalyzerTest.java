package me.golemcore.artifactor.domain.analysis;

import me.golemcore.artifactor.adapter.outbound.source.LocalSourceAccessAdapter;
import me.golemcore.artifactor.domain.model.analysis.LanguageInfo;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;
import me.golemcore.artifactor.domain.model.analysis.StaticAnalysisResult;
import me.golemcore.artifactor.domain.pipeline.PipelineExecutors;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StaticAnalyzerTest {

    @TempDir
    Path root;

    private PipelineExecutors executors;
    private LocalSourceAccessAdapter sourceAccess;
    private LanguageMap languages;

    @BeforeEach
    void setUp() throws IOException {
        executors = new PipelineExecutors(Executors.newFixedThreadPool(1), Executors.newFixedThreadPool(4),
                Executors.newFixedThreadPool(2));
        sourceAccess = new LocalSourceAccessAdapter(new ArtifactorProperties());
        languages = new LanguageMap(List.of(new LanguageInfo("python", 2, 0, List.of(".py"))), "python");

        Files.writeString(root.resolve("service.py"),
                "def handle():\n    return helper()\n\ndef helper():\n    return 1\n");
        Files.writeString(root.resolve("model.py"), "class Order:\n    total: int\n");
        Files.writeString(root.resolve("script.sh"), "echo ignored\n");
    }

    @AfterEach
    void tearDown() {
        executors.run().shutdownNow();
        executors.stage().shutdownNow();
        executors.parse().shutdownNow();
    }

    @Test
    void shouldRunAllExtractorsOverParsedSources() {
        StaticAnalysisResult result = analyzer(new SchemaExtractor()).analyze(root, languages);

        assertEquals(2, result.parsed().files().size());
        assertEquals(3, result.parsed().entities().size());
        assertEquals(1, result.callGraph().edges().size());
        assertEquals(1, result.schemas().schemas().size());
        assertTrue(result.endpoints().endpoints().isEmpty());
    }

    @Test
    void shouldKeepOtherResultsWhenOneExtractorFails() {
        StructureExtractor<SchemaMap> failing = new StructureExtractor<>() {
            @Override
            public String getName() {
                return "schemas";
            }

            @Override
            public SchemaMap extract(ParsedSources sources) {
                throw new IllegalStateException("schema parser crashed");
            }

            @Override
            public SchemaMap emptyResult() {
                return SchemaMap.empty();
            }
        };

        StaticAnalysisResult result = analyzer(failing).analyze(root, languages);

        assertTrue(result.schemas().schemas().isEmpty());
        assertEquals(1, result.callGraph().edges().size());
        assertEquals(3, result.parsed().entities().size());
    }

    @Test
    void shouldCompleteWhenCalledFromSingleThreadStagePool() throws Exception {
        PipelineExecutors narrow = new PipelineExecutors(Executors.newSingleThreadExecutor(),
                Executors.newSingleThreadExecutor(), Executors.newFixedThreadPool(2));
        try {
            StaticAnalyzer analyzer = new StaticAnalyzer(sourceAccess, new RegexSourceParser(),
                    new CallGraphExtractor(), new DependencyGraphExtractor(), new SchemaExtractor(),
                    new ApiEndpointExtractor(), narrow);

            StaticAnalysisResult result = CompletableFuture
                    .supplyAsync(() -> analyzer.analyze(root, languages), narrow.stage())
                    .get(5, TimeUnit.SECONDS);

            assertEquals(2, result.parsed().files().size());
            assertEquals(1, result.callGraph().edges().size());
        } finally {
            narrow.run().shutdownNow();
            narrow.stage().shutdownNow();
            narrow.parse().shutdownNow();
        }
    }

    private StaticAnalyzer analyzer(StructureExtractor<SchemaMap> schemaExtractor) {
        return new StaticAnalyzer(sourceAccess, new RegexSourceParser(), new CallGraphExtractor(),
                new DependencyGraphExtractor(), schemaExtractor, new ApiEndpointExtractor(), executors);
    }
}
