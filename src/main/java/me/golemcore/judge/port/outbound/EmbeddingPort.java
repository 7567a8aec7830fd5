package me.golemcore.judge.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for generating text embeddings (dense vector representations). Every
 * call may be billed and slow, so each entity is embedded once, at creation.
 */
public interface EmbeddingPort {

    /**
     * Generate embedding for a single text.
     *
     * @param text
     *            the text to embed
     * @return vector representation
     */
    CompletableFuture<float[]> embed(String text);

    /**
     * Generate embeddings for multiple texts (batch).
     *
     * @param texts
     *            list of texts to embed
     * @return list of vector representations, same order as the input
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    /**
     * Get the embedding dimension shared by every index in the graph.
     *
     * @return vector dimension (e.g., 1536 for OpenAI text-embedding-3-small)
     */
    int getDimension();

    /**
     * Get the model name.
     *
     * @return model identifier
     */
    String getModel();

    /**
     * Check if the embedding service is available.
     */
    boolean isAvailable();
}
