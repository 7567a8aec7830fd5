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
 * A remedy proposed for exactly one issue.
 */
@Value
@Builder(toBuilder = true)
public class Fix implements GraphEntity {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    String description;

    @Builder.Default
    Embedding embedding = Embedding.none();

    public static Fix of(String description) {
        return Fix.builder().description(description).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FIX;
    }

    @Override
    public Fix withEmbedding(Embedding embedding) {
        checkEmbeddingAssignable(embedding);
        return toBuilder().embedding(embedding).build();
    }
}
