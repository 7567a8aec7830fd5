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
 * One judged solution attempt. The description holds the agent output that was
 * evaluated. Attempts are always created fresh; repeated near-identical attempts
 * at the same policy are retained as distinct experience.
 */
@Value
@Builder(toBuilder = true)
public class Attempt implements GraphEntity {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    String description;

    @Builder.Default
    AttemptOutcome outcome = AttemptOutcome.UNJUDGED;

    /** Evaluator explanation of the verdict, may be null. */
    String reasoning;

    @Builder.Default
    Embedding embedding = Embedding.none();

    public static Attempt of(String description) {
        return Attempt.builder().description(description).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ATTEMPT;
    }

    /**
     * Copy carrying the evaluator verdict. Identifier and embedding are kept.
     */
    public Attempt judged(boolean successful, String reasoning) {
        return toBuilder()
                .outcome(AttemptOutcome.of(successful))
                .reasoning(reasoning)
                .build();
    }

    @Override
    public Attempt withEmbedding(Embedding embedding) {
        checkEmbeddingAssignable(embedding);
        return toBuilder().embedding(embedding).build();
    }
}
