package me.golemcore.judge.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.judge.domain.exception.CollaboratorException;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Attaches embeddings to graph entities through {@link EmbeddingPort}.
 *
 * <p>
 * When embeddings are switched off ({@code judge.embedding.enabled=false}) or
 * the embedder is not configured, entities come back unchanged, without an
 * embedding; downstream code treats those as "skip similarity". A failing
 * embedder call is a {@link CollaboratorException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityEmbeddingService {

    private final EmbeddingPort embeddingPort;
    private final JudgeProperties properties;

    public boolean isEnabled() {
        if (!properties.getEmbedding().isEnabled()) {
            return false;
        }
        if (!embeddingPort.isAvailable()) {
            log.warn("[Embedding] Embedder unavailable, entities will be stored without embeddings");
            return false;
        }
        return true;
    }

    /**
     * Embed free text, e.g. a query. Returns {@link Embedding#none()} when
     * embeddings are disabled.
     */
    public Embedding embedText(String text) {
        if (!isEnabled()) {
            return Embedding.none();
        }
        return Embedding.of(await(() -> embeddingPort.embed(text).get()));
    }

    /**
     * Returns a copy of the entity carrying its embedding. Entities that already
     * have one are returned as is.
     */
    public <T extends GraphEntity> T embed(T entity) {
        if (entity.getEmbedding().isPresent() || !isEnabled()) {
            return entity;
        }
        float[] vector = await(() -> embeddingPort.embed(entity.getEmbeddingText()).get());
        return withEmbedding(entity, vector);
    }

    /**
     * Batch variant of {@link #embed(GraphEntity)}: one embedder call for every
     * entity still missing an embedding. Order is preserved.
     */
    public <T extends GraphEntity> List<T> embedAll(List<T> entities) {
        List<T> missing = entities.stream().filter(e -> !e.getEmbedding().isPresent()).toList();
        if (missing.isEmpty() || !isEnabled()) {
            return entities;
        }

        List<String> texts = missing.stream().map(GraphEntity::getEmbeddingText).toList();
        List<float[]> vectors = await(() -> embeddingPort.embedBatch(texts).get());
        if (vectors.size() != missing.size()) {
            throw new CollaboratorException("Embedder returned " + vectors.size()
                    + " vectors for " + missing.size() + " texts");
        }

        List<T> result = new ArrayList<>(entities.size());
        int next = 0;
        for (T entity : entities) {
            if (entity.getEmbedding().isPresent()) {
                result.add(entity);
            } else {
                result.add(withEmbedding(entity, vectors.get(next++)));
            }
        }
        log.debug("[Embedding] Embedded {} of {} entities in one batch", missing.size(), entities.size());
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <T extends GraphEntity> T withEmbedding(T entity, float[] vector) {
        // each entity type returns its own type from withEmbedding
        return (T) entity.withEmbedding(Embedding.of(vector));
    }

    private static <R> R await(EmbeddingCall<R> call) {
        try {
            return call.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while waiting for embedder", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CollaboratorException("Embedder call failed: " + cause.getMessage(), cause);
        }
    }

    @FunctionalInterface
    private interface EmbeddingCall<R> {
        R get() throws InterruptedException, ExecutionException;
    }
}
