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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.model.ErrorClass;
import me.golemcore.artifactor.domain.model.ModelCallOutcome;
import me.golemcore.artifactor.domain.model.ModelReply;
import me.golemcore.artifactor.domain.model.ModelRequest;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.domain.service.TraceDispatcher;
import me.golemcore.artifactor.domain.trace.TraceEvents;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.ModelPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Calls models through a fallback chain.
 *
 * <p>
 * Each model is guarded by its own circuit breaker and retried with jittered
 * exponential backoff on rate limits. A reply that fails validation, an open
 * breaker or a failed call moves on to the next model. Non-retryable failures
 * are never retried on the model that raised them. Cancellation propagates.
 * When the chain is exhausted the result is
 * {@link ModelCallOutcome#noResult(List)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResilientModelCaller {

    private static final String DEFAULT_TRACE_ID = "llm";

    private final ModelPort modelPort;
    private final ModelCircuitBreakers circuitBreakers;
    private final TraceDispatcher traceDispatcher;
    private final ArtifactorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CompletableFuture<ModelCallOutcome> callWithFallback(ModelRequest request) {
        return callWithFallback(properties.getModels().getChain(), request);
    }

    public CompletableFuture<ModelCallOutcome> callWithFallback(List<String> chain, ModelRequest request) {
        return attempt(List.copyOf(chain), 0, request, new ArrayList<>()).toFuture();
    }

    private Mono<ModelCallOutcome> attempt(List<String> chain, int index, ModelRequest request,
            List<String> failures) {
        if (index >= chain.size()) {
            log.warn("[LLM] No usable reply for '{}' from {} model(s): {}", request.purpose(), chain.size(),
                    failures);
            return Mono.just(ModelCallOutcome.noResult(failures));
        }
        String model = chain.get(index);
        return Mono.defer(() -> {
            long startedAt = clock.millis();
            return guardedCall(model, request)
                    .onErrorResume(error -> isRecoverable(model, request, error, failures)
                            ? Mono.empty()
                            : Mono.error(error))
                    .filter(reply -> isAcceptable(model, reply, request, failures))
                    .map(reply -> {
                        recordCall(model, reply, request, clock.millis() - startedAt);
                        return ModelCallOutcome.success(model, reply, failures);
                    });
        }).switchIfEmpty(Mono.defer(() -> attempt(chain, index + 1, request, failures)));
    }

    private Mono<ModelReply> guardedCall(String model, ModelRequest request) {
        CircuitBreaker breaker = circuitBreakers.forModel(model);
        return Mono.fromFuture(() -> modelPort.call(model, request.messages(), request.timeout(), request.mode()))
                .timeout(request.timeout())
                .transformDeferred(CircuitBreakerOperator.of(breaker))
                .retryWhen(rateLimitRetry(model));
    }

    private RetryBackoffSpec rateLimitRetry(String model) {
        ArtifactorProperties.RetryProperties retry = properties.getRetry();
        return Retry.backoff(Math.max(0, retry.getMaxAttempts() - 1), retry.getInitialBackoff())
                .maxBackoff(retry.getMaxBackoff())
                .jitter(retry.getJitter())
                .filter(ErrorClassifier::isRateLimit)
                .doBeforeRetry(signal -> log.debug("[LLM] Rate limited by {}, retrying (attempt {})",
                        model, signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isRecoverable(String model, ModelRequest request, Throwable error, List<String> failures) {
        if (error instanceof CallNotPermittedException) {
            log.info("[LLM] Circuit open for {}, skipping", model);
            failures.add(model + ": circuit open");
            return true;
        }
        if (error instanceof CancellationException) {
            return false;
        }
        ErrorClass errorClass = ErrorClassifier.classify(error);
        if (errorClass.isRetryable()) {
            log.warn("[LLM] {} failed for '{}' ({}): {}", model, request.purpose(), errorClass, error.getMessage());
        } else {
            log.error("[LLM] {} failed for '{}' with non-retryable {} error, trying next model: {}", model,
                    request.purpose(), errorClass, error.getMessage());
        }
        failures.add(model + ": " + errorClass + " " + error.getMessage());
        return true;
    }

    private boolean isAcceptable(String model, ModelReply reply, ModelRequest request, List<String> failures) {
        String rejection = validate(reply, request);
        if (rejection == null) {
            return true;
        }
        log.info("[LLM] Reply from {} rejected for '{}': {}", model, request.purpose(), rejection);
        failures.add(model + ": " + rejection);
        return false;
    }

    private String validate(ModelReply reply, ModelRequest request) {
        if (reply == null || reply.content() == null || reply.content().isBlank()) {
            return "empty reply";
        }
        String content = reply.content().strip();
        if (content.length() < request.minLength()) {
            return "reply shorter than " + request.minLength() + " characters";
        }
        if (request.mode() == ResponseMode.JSON) {
            try {
                objectMapper.readTree(stripCodeFence(content));
            } catch (JsonProcessingException e) {
                return "reply is not valid JSON";
            }
        }
        if (request.validator() != null && !request.validator().test(content)) {
            return "reply failed validation";
        }
        return null;
    }

    private void recordCall(String model, ModelReply reply, ModelRequest request, long durationMs) {
        double cost = estimateCost(model, reply);
        String traceId = request.traceId() != null ? request.traceId() : DEFAULT_TRACE_ID;
        log.debug("[LLM] {} answered '{}' in {}ms ({} tokens)", model, request.purpose(), durationMs,
                reply.totalTokens());
        traceDispatcher.emit(TraceEvents.llmCall(traceId, Instant.now(clock), model, reply.inputTokens(),
                reply.outputTokens(), durationMs, cost));
    }

    double estimateCost(String model, ModelReply reply) {
        ArtifactorProperties.PricingProperties pricing = properties.getModels().getPricing().get(model);
        if (pricing == null) {
            return 0.0;
        }
        return reply.inputTokens() * pricing.getInputPerMillion() / 1_000_000.0
                + reply.outputTokens() * pricing.getOutputPerMillion() / 1_000_000.0;
    }

    /**
     * Remove a surrounding markdown code fence from a reply, if present.
     */
    public static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).strip();
    }
}
