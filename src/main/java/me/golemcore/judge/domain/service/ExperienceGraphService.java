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
import me.golemcore.judge.domain.exception.EntityNotFoundException;
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.GraphLink;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.RelationshipType;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.TraversalDirection;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed entity and relationship operations over {@link GraphStorePort}.
 *
 * <p>
 * Attempts, issues and fixes are always created as new nodes. Policies and
 * semantic categories should go through
 * {@link me.golemcore.judge.memory.EntityDeduplicator} instead of
 * {@link #createNode(GraphEntity)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExperienceGraphService {

    private final GraphStorePort graphStore;

    // ==================== WRITES ====================

    public String createNode(GraphEntity entity) {
        graphStore.createNode(entity);
        return entity.getId();
    }

    public String createAttempt(Attempt attempt) {
        return createNode(attempt);
    }

    public String createIssue(Issue issue) {
        return createNode(issue);
    }

    public String createFix(Fix fix) {
        return createNode(fix);
    }

    public void linkAttemptSatisfiesPolicy(String attemptId, String policyId) {
        graphStore.createRelationship(RelationshipType.SATISFIES, attemptId, policyId);
    }

    public void linkAttemptCausesIssue(String attemptId, String issueId) {
        graphStore.createRelationship(RelationshipType.CAUSES, attemptId, issueId);
    }

    public void linkFixResolvesIssue(String fixId, String issueId) {
        graphStore.createRelationship(RelationshipType.RESOLVES, fixId, issueId);
    }

    public void linkIssueAbstractsToSemantic(String issueId, String semanticId) {
        graphStore.createRelationship(RelationshipType.ABSTRACTS_TO, issueId, semanticId);
    }

    /**
     * Bulk wipe. Idempotent.
     */
    public void clearAll() {
        graphStore.clearAll();
        log.info("[GraphStore] Experience graph wiped");
    }

    // ==================== READS ====================

    public GraphEntity getNode(NodeKind kind, String id) {
        return graphStore.findNode(kind, id).orElseThrow(() -> EntityNotFoundException.forNode(kind, id));
    }

    public Policy getPolicy(String id) {
        return (Policy) getNode(NodeKind.POLICY, id);
    }

    public Attempt getAttempt(String id) {
        return (Attempt) getNode(NodeKind.ATTEMPT, id);
    }

    public Issue getIssue(String id) {
        return (Issue) getNode(NodeKind.ISSUE, id);
    }

    public List<Attempt> findAttemptsForPolicy(String policyId) {
        getNode(NodeKind.POLICY, policyId);
        return neighbors(RelationshipType.SATISFIES, TraversalDirection.INCOMING, List.of(policyId), Attempt.class)
                .getOrDefault(policyId, List.of());
    }

    public List<Issue> findIssuesForAttempt(String attemptId) {
        getNode(NodeKind.ATTEMPT, attemptId);
        return findIssuesForAttempts(List.of(attemptId)).getOrDefault(attemptId, List.of());
    }

    /**
     * Issues per attempt, keyed by attempt id. Attempts without issues are absent.
     */
    public Map<String, List<Issue>> findIssuesForAttempts(Collection<String> attemptIds) {
        return neighbors(RelationshipType.CAUSES, TraversalDirection.OUTGOING, attemptIds, Issue.class);
    }

    public List<Fix> findFixesForIssue(String issueId) {
        getNode(NodeKind.ISSUE, issueId);
        return findFixesForIssues(List.of(issueId)).getOrDefault(issueId, List.of());
    }

    public Map<String, List<Fix>> findFixesForIssues(Collection<String> issueIds) {
        return neighbors(RelationshipType.RESOLVES, TraversalDirection.INCOMING, issueIds, Fix.class);
    }

    public List<Semantic> findSemanticsForIssue(String issueId) {
        getNode(NodeKind.ISSUE, issueId);
        return neighbors(RelationshipType.ABSTRACTS_TO, TraversalDirection.OUTGOING, List.of(issueId),
                Semantic.class).getOrDefault(issueId, List.of());
    }

    public List<Semantic> listSemantics() {
        return graphStore.findAll(NodeKind.SEMANTIC).stream()
                .map(Semantic.class::cast)
                .toList();
    }

    public Map<NodeKind, Long> countNodes() {
        Map<NodeKind, Long> counts = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            counts.put(kind, graphStore.countNodes(kind));
        }
        return counts;
    }

    private <T extends GraphEntity> Map<String, List<T>> neighbors(RelationshipType type,
            TraversalDirection direction, Collection<String> anchorIds, Class<T> neighborType) {
        if (anchorIds.isEmpty()) {
            return Map.of();
        }
        Map<String, List<T>> grouped = new LinkedHashMap<>();
        for (GraphLink link : graphStore.traverse(type, direction, anchorIds)) {
            grouped.computeIfAbsent(link.anchorId(), id -> new ArrayList<>())
                    .add(neighborType.cast(link.neighbor()));
        }
        return grouped;
    }
}
