package me.golemcore.artifactor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Artifactor: analyzes a codebase through a staged pipeline and streams
 * progress while it generates documentation sections.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → AnalysisController, ProjectsController
 * Domain Layer       → PipelineRunner, AnalysisService, IdempotencyGuard
 * Infrastructure     → Model/Source/Checkpoint/Trace adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code artifactor.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArtifactorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArtifactorApplication.class, args);
    }

}
