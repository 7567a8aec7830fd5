package me.golemcore.judge.adapter.outbound.embedding;

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

import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Turns entity descriptions into vectors for the per-kind similarity indexes.
 * The requested dimension is {@code judge.embedding.dimension} and must match
 * the dimension the graph store indexes were created with.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code judge.llm.providers.openai.api-key} - OpenAI API key
 * <li>{@code judge.llm.providers.openai.base-url} - optional compatible endpoint
 * <li>{@code judge.embedding.model} - Embedding model name
 * </ul>
 *
 * @see me.golemcore.judge.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final JudgeProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        JudgeProperties.ProviderProperties openaiConfig = properties.getLlm().getProviders().get("openai");
        String apiKey = openaiConfig != null ? openaiConfig.getApiKey() : null;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        String model = getModel();
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .dimensions(getDimension())
                    .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));
            if (openaiConfig.getBaseUrl() != null) {
                builder.baseUrl(openaiConfig.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("Embedding model initialized: {} ({} dims)", model, getDimension());
        } catch (Exception e) {
            log.error("Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = embeddingModel.embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        if (!properties.getEmbedding().isEnabled()) {
            return false;
        }
        ensureInitialized();
        return embeddingModel != null;
    }
}
