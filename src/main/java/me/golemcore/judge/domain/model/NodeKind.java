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

import java.util.Locale;

/**
 * Node labels of the experience graph. Each kind owns its own similarity index,
 * so a nearest-neighbor query against one kind never returns nodes of another.
 */
public enum NodeKind {

    POLICY("Policy"),
    ATTEMPT("Attempt"),
    ISSUE("Issue"),
    FIX("Fix"),
    SEMANTIC("Semantic");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /**
     * Graph label, e.g. {@code Policy}.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Name of the vector index holding embeddings of this kind, e.g.
     * {@code policy_embedding}.
     */
    public String getIndexName() {
        return label.toLowerCase(Locale.ROOT) + "_embedding";
    }
}
