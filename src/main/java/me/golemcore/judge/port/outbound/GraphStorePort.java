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

import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.GraphLink;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.RelationshipType;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.model.TraversalDirection;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Port for the graph and vector store holding the experience graph.
 *
 * <p>
 * Every call is a single blocking round trip and independent of any other call;
 * there is no transaction spanning several calls. Failures raised by an
 * implementation propagate to the caller unchanged.
 */
public interface GraphStorePort {

    /**
     * Persist a node. A node with the same kind and identifier that already exists
     * is left untouched, so repeating the call is harmless.
     */
    void createNode(GraphEntity entity);

    /**
     * Look up a node by kind and identifier.
     */
    Optional<GraphEntity> findNode(NodeKind kind, String id);

    /**
     * All nodes of a kind, in a stable order.
     */
    List<GraphEntity> findAll(NodeKind kind);

    /**
     * Number of nodes of a kind.
     */
    long countNodes(NodeKind kind);

    /**
     * Create a directed edge between two existing nodes. Repeating the call for
     * the same pair does not add a second edge.
     *
     * @throws me.golemcore.judge.domain.exception.EntityNotFoundException
     *             if either endpoint does not exist; no edge is created
     */
    void createRelationship(RelationshipType type, String fromId, String toId);

    /**
     * Nearest neighbors of a query vector among the nodes of one kind.
     *
     * @param kind
     *            node kind whose index is searched
     * @param query
     *            present query embedding
     * @param limit
     *            maximum number of results
     * @return matches ordered by descending cosine similarity, at most
     *         {@code limit}, possibly empty
     */
    List<SimilarityMatch> findNearest(NodeKind kind, Embedding query, int limit);

    /**
     * One-hop traversal over edges of a type starting from the given anchors.
     *
     * @return one row per (anchor, neighbor) edge, grouped by anchor
     */
    List<GraphLink> traverse(RelationshipType type, TraversalDirection direction, Collection<String> anchorIds);

    /**
     * Delete all nodes and edges. Calling it on an empty store is a no-op.
     */
    void clearAll();
}
