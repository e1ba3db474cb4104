package me.golemcore.artifactor.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the analysis service.
 *
 * <p>
 * All configuration is organized under the {@code artifactor.*} prefix:
 * <ul>
 * <li>{@link ModelsProperties} - model fallback chain, providers and pricing</li>
 * <li>{@link AnalysisProperties} - stage concurrency, timeouts and sections</li>
 * <li>{@link RetryProperties} - rate-limit retry backoff</li>
 * <li>{@link CircuitBreakerProperties} - per-model circuit breakers</li>
 * <li>{@link GuardrailsProperties} - input limits and confidence gating</li>
 * <li>{@link TraceProperties} - enabled trace handlers</li>
 * <li>{@link ProgressProperties} - progress replay retention</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "artifactor")
@Data
public class ArtifactorProperties {

    private ModelsProperties models = new ModelsProperties();
    private AnalysisProperties analysis = new AnalysisProperties();
    private RetryProperties retry = new RetryProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private GuardrailsProperties guardrails = new GuardrailsProperties();
    private TraceProperties trace = new TraceProperties();
    private ProgressProperties progress = new ProgressProperties();
    private ExecutorProperties executor = new ExecutorProperties();

    @Data
    public static class ModelsProperties {
        /**
         * Ordered fallback chain of {@code provider/model} identifiers.
         */
        private List<String> chain = new ArrayList<>(List.of(
                "anthropic/claude-sonnet-4-20250514",
                "openai/gpt-4o-mini"));
        private Duration timeout = Duration.ofSeconds(120);
        private int maxOutputTokens = 4096;
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private Map<String, PricingProperties> pricing = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class PricingProperties {
        private double inputPerMillion;
        private double outputPerMillion;
    }

    @Data
    public static class AnalysisProperties {
        private int llmMaxConcurrency = 8;
        private Duration llmTimeout = Duration.ofMinutes(30);
        private int progressEvery = 5;
        private int sectionMaxConcurrency = 4;
        private Duration sectionTimeout = Duration.ofMinutes(20);
        private int sectionMaxIterations = 2;
        private int maxChunkLines = 200;
        private int minChunkLines = 10;
        private List<String> skipDirectories = new ArrayList<>(List.of(
                "node_modules", "target", "build", "dist", "venv", "__pycache__", "vendor"));
        private List<String> sections = new ArrayList<>(List.of(
                "executive_overview", "features", "personas", "user_stories", "security_requirements",
                "system_overview", "data_models", "interfaces", "ui_specs", "api_specs", "integrations",
                "tech_stories", "security_considerations"));
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double jitter = 0.5;
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 5;
        private Duration openDuration = Duration.ofSeconds(30);
    }

    @Data
    public static class GuardrailsProperties {
        private int maxInputLength = 10_000;
        private double lowConfidenceThreshold = 0.60;
    }

    @Data
    public static class TraceProperties {
        private boolean enabled = true;
        private List<String> handlers = new ArrayList<>(List.of("console", "cost_aggregator"));
    }

    @Data
    public static class ProgressProperties {
        /**
         * How long a completed run's progress log stays available to late joiners.
         */
        private Duration retention = Duration.ofMinutes(10);
    }

    @Data
    public static class ExecutorProperties {
        private int runThreads = 4;
        private int stageThreads = 16;
        private int parseThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
    }
}
