package me.golemcore.artifactor.domain.resilience;

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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import org.springframework.stereotype.Component;

/**
 * Registry of one circuit breaker per model name.
 *
 * <p>
 * A breaker opens after {@code failureThreshold} consecutive recorded failures
 * and stays open for {@code openDuration}. Rate-limit errors are ignored: they
 * are handled by backoff and say nothing about the model's health.
 */
@Component
@Slf4j
public class ModelCircuitBreakers {

    private static final String NAME_PREFIX = "model:";

    private final CircuitBreakerRegistry registry;

    public ModelCircuitBreakers(ArtifactorProperties properties) {
        ArtifactorProperties.CircuitBreakerProperties breaker = properties.getCircuitBreaker();
        int threshold = Math.max(1, breaker.getFailureThreshold());
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(breaker.getOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(1)
                .ignoreException(ErrorClassifier::isRateLimit)
                .build();
        this.registry = CircuitBreakerRegistry.of(config);
    }

    public CircuitBreaker forModel(String modelName) {
        return registry.circuitBreaker(NAME_PREFIX + modelName);
    }

    public CircuitBreaker.State stateOf(String modelName) {
        return forModel(modelName).getState();
    }
}
