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
import me.golemcore.judge.domain.model.GraphLink;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.RelationshipType;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.model.TraversalDirection;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranks semantic categories by how often they explain relevant issues.
 *
 * <p>
 * Two entry points:
 * <ul>
 * <li>{@link #findPatterns(Embedding, int)} starts from a query vector. Issues
 * similar to the query are fetched, those under
 * {@code judge.memory.pattern-issue-floor} are dropped before any traversal,
 * and the rest are grouped by the categories they abstract to.</li>
 * <li>{@link #findHistoryPatterns(Collection)} starts from known attempts and
 * walks attempt, issue, category.</li>
 * </ul>
 *
 * <p>
 * The aggregator only ranks. Callers decide whether a pattern is confident
 * enough to show to the evaluator.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticPatternAggregator {

    private final SimilarityIndex similarityIndex;
    private final GraphStorePort graphStore;
    private final JudgeProperties properties;

    public List<SemanticPattern> findPatterns(Embedding query) {
        return findPatterns(query, properties.getMemory().getPatternTopK());
    }

    /**
     * Categories behind the issues closest to the query.
     *
     * @param query
     *            query embedding
     * @param k
     *            maximum number of patterns
     * @return patterns by frequency (descending), then average similarity
     *         (descending)
     */
    public List<SemanticPattern> findPatterns(Embedding query, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        JudgeProperties.MemoryProperties memory = properties.getMemory();
        int fetch = SimilarityIndex.overfetchLimit(k, memory.getPatternOverfetch());

        Map<String, Double> issueScores = new LinkedHashMap<>();
        for (SimilarityMatch match : similarityIndex.query(NodeKind.ISSUE, query, fetch)) {
            if (match.score() >= memory.getPatternIssueFloor()) {
                issueScores.putIfAbsent(match.id(), match.score());
            }
        }
        if (issueScores.isEmpty()) {
            log.debug("[Patterns] No issues above floor {}", memory.getPatternIssueFloor());
            return List.of();
        }

        Map<String, Semantic> semantics = new LinkedHashMap<>();
        Map<String, Map<String, Double>> contributions = new LinkedHashMap<>();
        for (GraphLink link : graphStore.traverse(RelationshipType.ABSTRACTS_TO, TraversalDirection.OUTGOING,
                issueScores.keySet())) {
            Double score = issueScores.get(link.anchorId());
            if (score == null) {
                continue;
            }
            Semantic semantic = (Semantic) link.neighbor();
            semantics.putIfAbsent(semantic.getId(), semantic);
            contributions.computeIfAbsent(semantic.getId(), id -> new LinkedHashMap<>())
                    .putIfAbsent(link.anchorId(), score);
        }

        List<SemanticPattern> patterns = new ArrayList<>();
        for (Map.Entry<String, Map<String, Double>> entry : contributions.entrySet()) {
            Collection<Double> scores = entry.getValue().values();
            double avg = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            patterns.add(SemanticPattern.builder()
                    .semantic(semantics.get(entry.getKey()))
                    .frequency(scores.size())
                    .avgSimilarity(avg)
                    .build());
        }

        List<SemanticPattern> result = patterns.stream()
                .sorted(Comparator.comparingInt(SemanticPattern::getFrequency).reversed()
                        .thenComparing(Comparator.comparingDouble(SemanticPattern::getAvgSimilarity).reversed()))
                .limit(k)
                .toList();
        log.debug("[Patterns] {} issues above floor -> {} patterns (returning {})",
                issueScores.size(), patterns.size(), result.size());
        return result;
    }

    /**
     * Categories behind the issues of the given attempts.
     *
     * @param attemptIds
     *            attempts to walk from; empty yields an empty list without
     *            touching the store
     * @return patterns by issue count (descending)
     */
    public List<SemanticHistoryPattern> findHistoryPatterns(Collection<String> attemptIds) {
        if (attemptIds == null || attemptIds.isEmpty()) {
            return List.of();
        }

        Map<String, String> issueDescriptions = new LinkedHashMap<>();
        for (GraphLink link : graphStore.traverse(RelationshipType.CAUSES, TraversalDirection.OUTGOING,
                new LinkedHashSet<>(attemptIds))) {
            issueDescriptions.putIfAbsent(link.neighbor().getId(), link.neighbor().getDescription());
        }
        if (issueDescriptions.isEmpty()) {
            return List.of();
        }

        Map<String, Semantic> semantics = new LinkedHashMap<>();
        Map<String, Set<String>> issuesBySemantic = new LinkedHashMap<>();
        for (GraphLink link : graphStore.traverse(RelationshipType.ABSTRACTS_TO, TraversalDirection.OUTGOING,
                issueDescriptions.keySet())) {
            Semantic semantic = (Semantic) link.neighbor();
            semantics.putIfAbsent(semantic.getId(), semantic);
            issuesBySemantic.computeIfAbsent(semantic.getId(), id -> new LinkedHashSet<>()).add(link.anchorId());
        }

        int sampleSize = Math.max(0, properties.getMemory().getHistorySampleSize());
        List<SemanticHistoryPattern> patterns = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : issuesBySemantic.entrySet()) {
            List<String> samples = entry.getValue().stream()
                    .map(issueDescriptions::get)
                    .distinct()
                    .limit(sampleSize)
                    .toList();
            patterns.add(SemanticHistoryPattern.builder()
                    .semantic(semantics.get(entry.getKey()))
                    .issueCount(entry.getValue().size())
                    .sampleIssues(samples)
                    .build());
        }

        patterns.sort(Comparator.comparingInt(SemanticHistoryPattern::getIssueCount).reversed());
        log.debug("[Patterns] History over {} attempts: {} issues -> {} patterns",
                attemptIds.size(), issueDescriptions.size(), patterns.size());
        return List.copyOf(patterns);
    }
}
