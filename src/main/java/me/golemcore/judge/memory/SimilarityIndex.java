package me.golemcore.judge.memory;

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
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Per-kind nearest-neighbor lookup over the experience graph.
 *
 * <p>
 * Results are ordered by descending cosine similarity and hold at most
 * {@code k} entries, all of the requested kind. Ties keep the order the store
 * returned them in. An empty result is valid and not an error.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimilarityIndex {

    private final GraphStorePort graphStore;

    /**
     * Find the {@code k} nodes of a kind closest to the query.
     *
     * @param kind
     *            node kind to search
     * @param query
     *            query embedding, must be present
     * @param k
     *            maximum number of results, at least 1
     * @return matches sorted by score (descending)
     */
    public List<SimilarityMatch> query(NodeKind kind, Embedding query, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        if (query == null || !query.isPresent()) {
            throw new IllegalArgumentException("A present query embedding is required to search " + kind.getLabel());
        }

        List<SimilarityMatch> matches = graphStore.findNearest(kind, query, k);

        // List.sort is stable, so equal scores keep the store's native order
        List<SimilarityMatch> result = matches.stream()
                .filter(match -> match.entity().getKind() == kind)
                .sorted(Comparator.comparingDouble(SimilarityMatch::score).reversed())
                .limit(k)
                .toList();

        log.debug("[SimilarityIndex] {} query k={} returned {} matches", kind.getLabel(), k, result.size());
        for (SimilarityMatch match : result) {
            log.trace("[SimilarityIndex]   - {} (score: {})", match.id(), String.format("%.3f", match.score()));
        }
        return result;
    }

    /**
     * Candidate count for a top-{@code k} request over-fetched by
     * {@code factor}, saturating at {@link Integer#MAX_VALUE}. Factors below 1
     * count as 1.
     */
    static int overfetchLimit(int k, int factor) {
        return (int) Math.min(Integer.MAX_VALUE, (long) k * Math.max(1, factor));
    }
}
