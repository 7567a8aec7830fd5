package me.golemcore.judge.domain.model;

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

/**
 * Common view of the five node kinds stored in the experience graph.
 *
 * <p>
 * Identifiers are assigned at construction and never change. An embedding, once
 * present, is never replaced: {@link #withEmbedding(Embedding)} only fills an
 * absent one, and re-embedding requires a new entity.
 */
public interface GraphEntity {

    String getId();

    NodeKind getKind();

    String getDescription();

    Embedding getEmbedding();

    /**
     * Text handed to the embedder for this entity.
     */
    default String getEmbeddingText() {
        return getDescription();
    }

    /**
     * Returns a copy carrying the given embedding.
     *
     * @throws IllegalStateException
     *             if this entity already has an embedding
     */
    GraphEntity withEmbedding(Embedding embedding);

    /**
     * Guard shared by {@link #withEmbedding(Embedding)} implementations.
     */
    default void checkEmbeddingAssignable(Embedding embedding) {
        if (embedding == null || !embedding.isPresent()) {
            throw new IllegalArgumentException("Cannot assign an absent embedding to " + getKind().getLabel());
        }
        if (getEmbedding().isPresent()) {
            throw new IllegalStateException(getKind().getLabel() + " " + getId() + " already has an embedding");
        }
    }
}
