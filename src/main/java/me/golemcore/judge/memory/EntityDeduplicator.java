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
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.model.UpsertResult;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reuse-or-create decision for deduplicated node kinds (Policy and Semantic).
 *
 * <p>
 * A candidate is compared with its single nearest neighbor of the same kind. If
 * that neighbor scores at or above the threshold, its id is returned and the
 * candidate is discarded; otherwise the candidate is persisted. A candidate
 * without an embedding skips the check and is always created.
 *
 * <p>
 * Thresholds resolve per call first, then from {@code judge.memory.*-threshold}
 * (which the environment may override).
 *
 * <p>
 * Upserts of the same kind are serialized through one fair lock per kind, so the
 * similarity check and the create cannot interleave with another upsert of that
 * kind in this process. Service instances sharing one store still dedup only
 * eventually.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EntityDeduplicator {

    private static final Set<NodeKind> DEDUPLICATED_KINDS = Set.of(NodeKind.POLICY, NodeKind.SEMANTIC);

    private final SimilarityIndex similarityIndex;
    private final GraphStorePort graphStore;
    private final JudgeProperties properties;

    private final Map<NodeKind, ReentrantLock> upsertLocks = createLocks();

    public UpsertResult getOrCreatePolicy(Policy candidate) {
        return getOrCreate(candidate, properties.getMemory().getPolicyThreshold());
    }

    public UpsertResult getOrCreatePolicy(Policy candidate, double threshold) {
        return getOrCreate(candidate, threshold);
    }

    public UpsertResult getOrCreateSemantic(Semantic candidate) {
        return getOrCreate(candidate, properties.getMemory().getSemanticThreshold());
    }

    public UpsertResult getOrCreateSemantic(Semantic candidate, double threshold) {
        return getOrCreate(candidate, threshold);
    }

    /**
     * Reuse the nearest existing node of the candidate's kind if it is similar
     * enough, otherwise persist the candidate.
     *
     * @param candidate
     *            policy or semantic candidate
     * @param threshold
     *            minimum cosine similarity for reuse, in [-1, 1]
     * @return id of the node now representing the candidate and whether it was
     *         created
     */
    public UpsertResult getOrCreate(GraphEntity candidate, double threshold) {
        NodeKind kind = candidate.getKind();
        if (!DEDUPLICATED_KINDS.contains(kind)) {
            throw new IllegalArgumentException(kind.getLabel() + " nodes are never deduplicated");
        }
        if (threshold < -1.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be within [-1, 1], got " + threshold);
        }

        ReentrantLock lock = upsertLocks.get(kind);
        lock.lock();
        try {
            if (!candidate.getEmbedding().isPresent()) {
                graphStore.createNode(candidate);
                log.info("[Dedup] {} {} created without similarity check (no embedding)",
                        kind.getLabel(), candidate.getId());
                return UpsertResult.created(candidate.getId());
            }

            List<SimilarityMatch> nearest = similarityIndex.query(kind, candidate.getEmbedding(), 1);
            if (!nearest.isEmpty() && nearest.get(0).score() >= threshold) {
                SimilarityMatch existing = nearest.get(0);
                log.info("[Dedup] {} reused: {} (score: {}, threshold: {})",
                        kind.getLabel(), existing.id(), String.format("%.3f", existing.score()), threshold);
                return UpsertResult.reused(existing.id());
            }

            graphStore.createNode(candidate);
            log.info("[Dedup] {} created: {} (nearest score: {}, threshold: {})",
                    kind.getLabel(), candidate.getId(),
                    nearest.isEmpty() ? "n/a" : String.format("%.3f", nearest.get(0).score()), threshold);
            return UpsertResult.created(candidate.getId());
        } finally {
            lock.unlock();
        }
    }

    private static Map<NodeKind, ReentrantLock> createLocks() {
        Map<NodeKind, ReentrantLock> locks = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : DEDUPLICATED_KINDS) {
            locks.put(kind, new ReentrantLock(true));
        }
        return locks;
    }
}
