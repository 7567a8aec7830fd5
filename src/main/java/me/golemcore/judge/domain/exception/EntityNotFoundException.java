package me.golemcore.judge.domain.exception;

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

import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.RelationshipType;

/**
 * Raised when an operation references a node that does not exist in the graph,
 * most notably when a relationship is requested before both endpoints were
 * persisted. The relationship is not created.
 */
public class EntityNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EntityNotFoundException(String message) {
        super(message);
    }

    public static EntityNotFoundException forNode(NodeKind kind, String id) {
        return new EntityNotFoundException(kind.getLabel() + " not found: " + id);
    }

    public static EntityNotFoundException forRelationship(RelationshipType type, String fromId, String toId) {
        return new EntityNotFoundException(String.format(
                "Cannot create %s: %s %s or %s %s does not exist",
                type, type.getSourceKind().getLabel(), fromId, type.getTargetKind().getLabel(), toId));
    }
}
