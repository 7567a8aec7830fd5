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
 * Directed edge types of the experience graph with their endpoint kinds.
 */
public enum RelationshipType {

    /** Attempt → Policy */
    SATISFIES(NodeKind.ATTEMPT, NodeKind.POLICY),

    /** Attempt → Issue */
    CAUSES(NodeKind.ATTEMPT, NodeKind.ISSUE),

    /** Fix → Issue */
    RESOLVES(NodeKind.FIX, NodeKind.ISSUE),

    /** Issue → Semantic */
    ABSTRACTS_TO(NodeKind.ISSUE, NodeKind.SEMANTIC);

    private final NodeKind sourceKind;
    private final NodeKind targetKind;

    RelationshipType(NodeKind sourceKind, NodeKind targetKind) {
        this.sourceKind = sourceKind;
        this.targetKind = targetKind;
    }

    public NodeKind getSourceKind() {
        return sourceKind;
    }

    public NodeKind getTargetKind() {
        return targetKind;
    }

    /**
     * Kind of the node reached when walking this edge in the given direction.
     */
    public NodeKind neighborKind(TraversalDirection direction) {
        return direction == TraversalDirection.OUTGOING ? targetKind : sourceKind;
    }

    /**
     * Kind of the node the walk starts from.
     */
    public NodeKind anchorKind(TraversalDirection direction) {
        return direction == TraversalDirection.OUTGOING ? sourceKind : targetKind;
    }
}
