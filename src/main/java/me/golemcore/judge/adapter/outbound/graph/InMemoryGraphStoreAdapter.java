package me.golemcore.judge.adapter.outbound.graph;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.judge.domain.exception.EntityNotFoundException;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.GraphLink;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.RelationshipType;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.model.TraversalDirection;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process graph store with exact (brute-force) cosine search.
 *
 * <p>
 * Nodes are kept per kind in insertion order, edges as adjacency sets in both
 * directions. Nearest-neighbor queries scan every embedded node of the
 * requested kind; equal scores keep insertion order. Contents live only as
 * long as the process.
 *
 * <p>
 * Thread-safe: reads share a {@link ReentrantReadWriteLock}, writes take it
 * exclusively.
 *
 * @since 1.0
 */
@Component
@ConditionalOnProperty(prefix = "judge.graph", name = "store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryGraphStoreAdapter implements GraphStorePort {

    private final JudgeProperties properties;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<NodeKind, Map<String, GraphEntity>> nodes = new EnumMap<>(NodeKind.class);
    private final Map<RelationshipType, Map<String, Set<String>>> outgoing = new EnumMap<>(RelationshipType.class);
    private final Map<RelationshipType, Map<String, Set<String>>> incoming = new EnumMap<>(RelationshipType.class);

    public InMemoryGraphStoreAdapter(JudgeProperties properties) {
        this.properties = properties;
        for (NodeKind kind : NodeKind.values()) {
            nodes.put(kind, new LinkedHashMap<>());
        }
        for (RelationshipType type : RelationshipType.values()) {
            outgoing.put(type, new LinkedHashMap<>());
            incoming.put(type, new LinkedHashMap<>());
        }
        log.info("[GraphStore] Using in-memory graph store");
    }

    @Override
    public void createNode(GraphEntity entity) {
        Embedding embedding = entity.getEmbedding();
        int expected = properties.getEmbedding().getDimension();
        if (embedding.isPresent() && embedding.dimension() != expected) {
            throw new IllegalArgumentException(String.format("%s %s has embedding dimension %d, expected %d",
                    entity.getKind().getLabel(), entity.getId(), embedding.dimension(), expected));
        }

        lock.writeLock().lock();
        try {
            GraphEntity existing = nodes.get(entity.getKind()).putIfAbsent(entity.getId(), entity);
            if (existing == null) {
                log.debug("[GraphStore] Created {} {}", entity.getKind().getLabel(), entity.getId());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GraphEntity> findNode(NodeKind kind, String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(kind).get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphEntity> findAll(NodeKind kind) {
        lock.readLock().lock();
        try {
            return List.copyOf(nodes.get(kind).values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countNodes(NodeKind kind) {
        lock.readLock().lock();
        try {
            return nodes.get(kind).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void createRelationship(RelationshipType type, String fromId, String toId) {
        lock.writeLock().lock();
        try {
            if (!nodes.get(type.getSourceKind()).containsKey(fromId)
                    || !nodes.get(type.getTargetKind()).containsKey(toId)) {
                throw EntityNotFoundException.forRelationship(type, fromId, toId);
            }
            boolean added = outgoing.get(type).computeIfAbsent(fromId, id -> new LinkedHashSet<>()).add(toId);
            incoming.get(type).computeIfAbsent(toId, id -> new LinkedHashSet<>()).add(fromId);
            if (added) {
                log.debug("[GraphStore] Linked {} -[{}]-> {}", fromId, type, toId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SimilarityMatch> findNearest(NodeKind kind, Embedding query, int limit) {
        lock.readLock().lock();
        try {
            List<SimilarityMatch> candidates = new ArrayList<>();
            for (GraphEntity entity : nodes.get(kind).values()) {
                if (entity.getEmbedding().isPresent()) {
                    candidates.add(new SimilarityMatch(entity, query.cosineSimilarity(entity.getEmbedding())));
                }
            }
            return candidates.stream()
                    .sorted(Comparator.comparingDouble(SimilarityMatch::score).reversed())
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphLink> traverse(RelationshipType type, TraversalDirection direction,
            Collection<String> anchorIds) {
        Map<String, Set<String>> adjacency = direction == TraversalDirection.OUTGOING
                ? outgoing.get(type)
                : incoming.get(type);
        Map<String, GraphEntity> neighbors = nodes.get(type.neighborKind(direction));

        lock.readLock().lock();
        try {
            List<GraphLink> links = new ArrayList<>();
            for (String anchorId : new LinkedHashSet<>(anchorIds)) {
                for (String neighborId : adjacency.getOrDefault(anchorId, Set.of())) {
                    GraphEntity neighbor = neighbors.get(neighborId);
                    if (neighbor != null) {
                        links.add(new GraphLink(anchorId, neighbor));
                    }
                }
            }
            return links;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clearAll() {
        lock.writeLock().lock();
        try {
            nodes.values().forEach(Map::clear);
            outgoing.values().forEach(Map::clear);
            incoming.values().forEach(Map::clear);
            log.info("[GraphStore] Cleared all nodes and relationships");
        } finally {
            lock.writeLock().unlock();
        }
    }
}
