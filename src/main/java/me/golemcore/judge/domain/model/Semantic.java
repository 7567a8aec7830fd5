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

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * An abstracted root-cause category grouping similar issues, e.g.
 * {@code SQL Injection Vulnerability}. Deduplicated with a looser threshold than
 * policies.
 */
@Value
@Builder(toBuilder = true)
public class Semantic implements GraphEntity {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    /** Short category label. */
    String name;

    String description;

    @Builder.Default
    Embedding embedding = Embedding.none();

    public static Semantic of(String name, String description) {
        return Semantic.builder().name(name).description(description).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SEMANTIC;
    }

    @Override
    public String getEmbeddingText() {
        return description != null && !description.isBlank() ? name + ": " + description : name;
    }

    @Override
    public Semantic withEmbedding(Embedding embedding) {
        checkEmbeddingAssignable(embedding);
        return toBuilder().embedding(embedding).build();
    }
}
