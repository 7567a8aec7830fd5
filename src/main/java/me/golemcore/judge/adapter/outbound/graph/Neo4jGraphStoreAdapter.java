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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.judge.domain.exception.EntityNotFoundException;
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.AttemptOutcome;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.GraphLink;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.RelationshipType;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.model.TraversalDirection;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Graph store backed by Neo4j with one native vector index per node label.
 *
 * <p>
 * Indexes are named {@code <label>_embedding} (cosine, dimension from
 * {@code judge.embedding.dimension}) and created on startup together with an
 * {@code id} uniqueness constraint per label. Nodes and relationships are
 * written with {@code MERGE}, so repeating a write is harmless. Vector index
 * scores are rescaled to raw cosine.
 *
 * <p>
 * Driver failures propagate unchanged to the caller.
 *
 * @since 1.0
 */
@Component
@ConditionalOnProperty(prefix = "judge.graph", name = "store", havingValue = "neo4j")
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphStoreAdapter implements GraphStorePort {

    private static final String PROP_ID = "id";
    private static final String PROP_DESCRIPTION = "description";
    private static final String PROP_NAME = "name";
    private static final String PROP_OUTCOME = "outcome";
    private static final String PROP_REASONING = "reasoning";
    private static final String PROP_EMBEDDING = "embedding";

    private final Driver driver;
    private final JudgeProperties properties;

    @PostConstruct
    public void init() {
        int dimension = properties.getEmbedding().getDimension();
        try (Session session = openSession()) {
            for (NodeKind kind : NodeKind.values()) {
                String label = kind.getLabel();
                session.run(String.format(
                        "CREATE CONSTRAINT %s_id IF NOT EXISTS FOR (n:%s) REQUIRE n.id IS UNIQUE",
                        label.toLowerCase(Locale.ROOT), label)).consume();
                session.run(String.format(
                        "CREATE VECTOR INDEX %s IF NOT EXISTS FOR (n:%s) ON (n.embedding) "
                                + "OPTIONS {indexConfig: {`vector.dimensions`: %d, "
                                + "`vector.similarity_function`: 'cosine'}}",
                        kind.getIndexName(), label, dimension)).consume();
            }
        }
        log.info("[Neo4j] Vector indexes ready ({} dims)", dimension);
    }

    @Override
    public void createNode(GraphEntity entity) {
        String query = String.format("MERGE (n:%s {id: $id}) ON CREATE SET n += $props",
                entity.getKind().getLabel());
        try (Session session = openSession()) {
            session.run(query, Map.of(PROP_ID, entity.getId(), "props", toProperties(entity))).consume();
        }
        log.debug("[Neo4j] Merged {} {}", entity.getKind().getLabel(), entity.getId());
    }

    @Override
    public Optional<GraphEntity> findNode(NodeKind kind, String id) {
        String query = String.format("MATCH (n:%s {id: $id}) RETURN n {.*} AS n", kind.getLabel());
        try (Session session = openSession()) {
            List<Record> records = session.run(query, Map.of(PROP_ID, id)).list();
            if (records.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(toEntity(kind, records.get(0).get("n").asMap()));
        }
    }

    @Override
    public List<GraphEntity> findAll(NodeKind kind) {
        String query = String.format("MATCH (n:%s) RETURN n {.*} AS n ORDER BY n.id", kind.getLabel());
        try (Session session = openSession()) {
            List<GraphEntity> entities = new ArrayList<>();
            for (Record record : session.run(query).list()) {
                entities.add(toEntity(kind, record.get("n").asMap()));
            }
            return entities;
        }
    }

    @Override
    public long countNodes(NodeKind kind) {
        String query = String.format("MATCH (n:%s) RETURN count(n) AS total", kind.getLabel());
        try (Session session = openSession()) {
            return session.run(query).single().get("total").asLong();
        }
    }

    @Override
    public void createRelationship(RelationshipType type, String fromId, String toId) {
        String query = String.format(
                "MATCH (a:%s {id: $fromId}) MATCH (b:%s {id: $toId}) "
                        + "MERGE (a)-[r:%s]->(b) RETURN count(r) AS linked",
                type.getSourceKind().getLabel(), type.getTargetKind().getLabel(), type.name());
        long linked;
        try (Session session = openSession()) {
            linked = session.run(query, Map.of("fromId", fromId, "toId", toId)).single().get("linked").asLong();
        }
        if (linked == 0) {
            throw EntityNotFoundException.forRelationship(type, fromId, toId);
        }
        log.debug("[Neo4j] Linked {} -[{}]-> {}", fromId, type, toId);
    }

    @Override
    public List<SimilarityMatch> findNearest(NodeKind kind, Embedding query, int limit) {
        String cypher = "CALL db.index.vector.queryNodes($index, $k, $embedding) YIELD node, score "
                + "RETURN node {.*} AS n, score ORDER BY score DESC";
        Map<String, Object> params = Map.of(
                "index", kind.getIndexName(),
                "k", limit,
                PROP_EMBEDDING, query.toList());
        try (Session session = openSession()) {
            List<SimilarityMatch> matches = new ArrayList<>();
            for (Record record : session.run(cypher, params).list()) {
                matches.add(new SimilarityMatch(toEntity(kind, record.get("n").asMap()),
                        toCosine(record.get("score").asDouble())));
            }
            return matches;
        }
    }

    @Override
    public List<GraphLink> traverse(RelationshipType type, TraversalDirection direction,
            Collection<String> anchorIds) {
        if (anchorIds.isEmpty()) {
            return List.of();
        }
        NodeKind anchorKind = type.anchorKind(direction);
        NodeKind neighborKind = type.neighborKind(direction);
        String pattern = direction == TraversalDirection.OUTGOING
                ? "(a:%s)-[:%s]->(b:%s)"
                : "(a:%s)<-[:%s]-(b:%s)";
        String query = "MATCH " + String.format(pattern, anchorKind.getLabel(), type.name(), neighborKind.getLabel())
                + " WHERE a.id IN $ids RETURN a.id AS anchorId, b {.*} AS n ORDER BY anchorId, b.id";

        try (Session session = openSession()) {
            List<GraphLink> links = new ArrayList<>();
            for (Record record : session.run(query, Map.of("ids", new ArrayList<>(new LinkedHashSet<>(anchorIds))))
                    .list()) {
                links.add(new GraphLink(record.get("anchorId").asString(),
                        toEntity(neighborKind, record.get("n").asMap())));
            }
            return links;
        }
    }

    @Override
    public void clearAll() {
        try (Session session = openSession()) {
            session.run("MATCH (n) DETACH DELETE n").consume();
        }
        log.info("[Neo4j] Cleared all nodes and relationships");
    }

    private Session openSession() {
        String database = properties.getGraph().getNeo4j().getDatabase();
        SessionConfig config = database != null && !database.isBlank()
                ? SessionConfig.forDatabase(database)
                : SessionConfig.defaultConfig();
        return driver.session(config);
    }

    static Map<String, Object> toProperties(GraphEntity entity) {
        Map<String, Object> props = new HashMap<>();
        props.put(PROP_ID, entity.getId());
        props.put(PROP_DESCRIPTION, entity.getDescription());
        if (entity instanceof Semantic semantic) {
            props.put(PROP_NAME, semantic.getName());
        }
        if (entity instanceof Attempt attempt) {
            props.put(PROP_OUTCOME, attempt.getOutcome().name());
            if (attempt.getReasoning() != null) {
                props.put(PROP_REASONING, attempt.getReasoning());
            }
        }
        if (entity.getEmbedding().isPresent()) {
            props.put(PROP_EMBEDDING, entity.getEmbedding().toList());
        }
        return props;
    }

    static GraphEntity toEntity(NodeKind kind, Map<String, Object> props) {
        String id = (String) props.get(PROP_ID);
        String description = (String) props.get(PROP_DESCRIPTION);
        Embedding embedding = toEmbedding(props.get(PROP_EMBEDDING));
        return switch (kind) {
        case POLICY -> Policy.builder().id(id).description(description).embedding(embedding).build();
        case ATTEMPT -> Attempt.builder()
                .id(id)
                .description(description)
                .outcome(toOutcome(props.get(PROP_OUTCOME)))
                .reasoning((String) props.get(PROP_REASONING))
                .embedding(embedding)
                .build();
        case ISSUE -> Issue.builder().id(id).description(description).embedding(embedding).build();
        case FIX -> Fix.builder().id(id).description(description).embedding(embedding).build();
        case SEMANTIC -> Semantic.builder()
                .id(id)
                .name((String) props.get(PROP_NAME))
                .description(description)
                .embedding(embedding)
                .build();
        };
    }

    /**
     * Cosine vector indexes report {@code (1 + cos) / 2}; the port speaks raw
     * cosine in [-1, 1].
     */
    static double toCosine(double indexScore) {
        return 2.0 * indexScore - 1.0;
    }

    private static AttemptOutcome toOutcome(Object value) {
        if (value == null) {
            return AttemptOutcome.UNJUDGED;
        }
        return AttemptOutcome.valueOf(value.toString());
    }

    private static Embedding toEmbedding(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return Embedding.none();
        }
        float[] vector = new float[list.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = ((Number) list.get(i)).floatValue();
        }
        return Embedding.of(vector);
    }
}
