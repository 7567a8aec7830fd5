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
 * A distinct task or requirement that attempts try to satisfy. Policies are
 * deduplicated by embedding similarity, so paraphrases of the same task share one
 * node.
 */
@Value
@Builder(toBuilder = true)
public class Policy implements GraphEntity {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    String description;

    @Builder.Default
    Embedding embedding = Embedding.none();

    public static Policy of(String description) {
        return Policy.builder().description(description).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.POLICY;
    }

    @Override
    public Policy withEmbedding(Embedding embedding) {
        checkEmbeddingAssignable(embedding);
        return toBuilder().embedding(embedding).build();
    }
}
