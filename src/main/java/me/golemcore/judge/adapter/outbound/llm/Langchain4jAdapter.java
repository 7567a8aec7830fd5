package me.golemcore.judge.adapter.outbound.llm;

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

import me.golemcore.judge.domain.model.LlmRequest;
import me.golemcore.judge.domain.model.LlmResponse;
import me.golemcore.judge.domain.model.Message;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.LlmPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible API endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Models are addressed as {@code provider/model} ("anthropic/claude-3-5-haiku-latest");
 * a bare name is routed to Anthropic when it starts with {@code claude}, to
 * OpenAI otherwise. Rate-limit errors are retried with exponential backoff.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code judge.llm.*}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    /**
     * Max retry attempts for rate limit / transient errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final JudgeProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    static String getProvider(String model) {
        if (model.contains("/")) {
            return model.substring(0, model.indexOf('/'));
        }
        return model.startsWith("claude") ? PROVIDER_ANTHROPIC : PROVIDER_OPENAI;
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private JudgeProperties.ProviderProperties getProviderConfig(String providerName) {
        JudgeProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add judge.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    /**
     * Create a model instance based on configuration.
     */
    private ChatModel createModel(String model) {
        String provider = getProvider(model);
        JudgeProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);

        ChatModel chatModel = PROVIDER_ANTHROPIC.equals(provider)
                ? createAnthropicModel(modelName, config)
                : createOpenAiModel(modelName, config);
        log.info("Langchain4j chat model initialized: {} ({})", modelName, provider);
        return chatModel;
    }

    private ChatModel createAnthropicModel(String modelName, JudgeProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(4096)
                .temperature(properties.getLlm().getTemperature())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, JudgeProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .temperature(properties.getLlm().getTemperature())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null && !request.getModel().isBlank()
                    ? request.getModel()
                    : getCurrentModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);
            List<ChatMessage> messages = convertMessages(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return convertResponse(response, model);
                } catch (Exception e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        try {
                            Thread.sleep(backoffMs);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new RuntimeException("LLM chat interrupted during retry backoff", ie);
                        }
                    } else {
                        log.error("LLM chat failed", e);
                        throw new RuntimeException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new RuntimeException("LLM chat failed: max retries exhausted");
        });
    }

    static boolean isRateLimitError(Throwable e) {
        // Walk the cause chain looking for rate limit indicators
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    static List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }

        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();

        LlmResponse.LlmResponseBuilder builder = LlmResponse.builder()
                .content(aiMessage.text())
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop");
        if (response.tokenUsage() != null) {
            builder.inputTokens(response.tokenUsage().inputTokenCount())
                    .outputTokens(response.tokenUsage().outputTokenCount());
        }
        return builder.build();
    }
}
