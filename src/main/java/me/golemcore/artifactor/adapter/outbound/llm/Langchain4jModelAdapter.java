package me.golemcore.artifactor.adapter.outbound.llm;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.exception.ModelCallException;
import me.golemcore.artifactor.domain.model.ModelMessage;
import me.golemcore.artifactor.domain.model.ModelReply;
import me.golemcore.artifactor.domain.model.ResponseMode;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.ModelPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ModelPort} backed by LangChain4j chat models.
 *
 * <p>
 * Model identifiers take the form {@code provider/model}. Anthropic models use
 * the native client; every other provider goes through the OpenAI-compatible
 * client with the configured base URL. LangChain4j retries are disabled since
 * retries and fallback are handled by the caller.
 *
 * <p>
 * Configuration via {@code artifactor.models.providers.*}.
 */
@Component
@Slf4j
public class Langchain4jModelAdapter implements ModelPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final ArtifactorProperties properties;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public Langchain4jModelAdapter(ArtifactorProperties properties) {
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "model-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public CompletableFuture<ModelReply> call(String modelName, List<ModelMessage> messages, Duration timeout,
            ResponseMode mode) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel chatModel = models.computeIfAbsent(modelName + "@" + timeout.toMillis(),
                    key -> createModel(modelName, timeout));
            ChatRequest.Builder request = ChatRequest.builder().messages(convertMessages(messages));
            if (mode == ResponseMode.JSON && !PROVIDER_ANTHROPIC.equals(providerOf(modelName))) {
                request.responseFormat(ResponseFormat.JSON);
            }
            try {
                ChatResponse response = chatModel.chat(request.build());
                return convertResponse(response);
            } catch (RuntimeException e) {
                throw new ModelCallException("Model " + modelName + " failed: " + e.getMessage(), statusOf(e), e);
            }
        }, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    static String providerOf(String modelName) {
        int slash = modelName.indexOf('/');
        return slash > 0 ? modelName.substring(0, slash) : "openai";
    }

    static String stripProviderPrefix(String modelName) {
        return modelName.contains("/") ? modelName.substring(modelName.indexOf('/') + 1) : modelName;
    }

    private ArtifactorProperties.ProviderProperties getProviderConfig(String provider) {
        ArtifactorProperties.ProviderProperties config = properties.getModels().getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new ModelCallException("Provider not configured: " + provider
                    + ". Add artifactor.models.providers." + provider + ".api-key");
        }
        return config;
    }

    private ChatModel createModel(String modelName, Duration timeout) {
        String provider = providerOf(modelName);
        ArtifactorProperties.ProviderProperties config = getProviderConfig(provider);
        String name = stripProviderPrefix(modelName);
        log.info("[LLM] Creating {} client for {}", provider, name);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(name)
                    .maxRetries(0)
                    .maxTokens(properties.getModels().getMaxOutputTokens())
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(name)
                .maxRetries(0)
                .maxTokens(properties.getModels().getMaxOutputTokens())
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    /**
     * LangChain4j maps HTTP failures to typed exceptions that keep the original
     * {@link HttpException} as their cause.
     */
    static Integer statusOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpException http) {
                return http.statusCode();
            }
            current = current.getCause();
        }
        return null;
    }

    static List<ChatMessage> convertMessages(List<ModelMessage> messages) {
        List<ChatMessage> converted = new ArrayList<>(messages.size());
        for (ModelMessage message : messages) {
            converted.add(switch (message.role()) {
            case SYSTEM -> SystemMessage.from(message.content());
            case USER -> UserMessage.from(message.content());
            });
        }
        return converted;
    }

    private static ModelReply convertResponse(ChatResponse response) {
        String content = response.aiMessage() != null ? response.aiMessage().text() : null;
        TokenUsage usage = response.tokenUsage();
        int input = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int output = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        return new ModelReply(content != null ? content : "", input, output);
    }
}
