package me.golemcore.judge.memory;

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
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.AttemptOutcome;
import me.golemcore.judge.domain.model.ContrastiveExamples;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Nearest prior attempts split by outcome.
 *
 * <p>
 * The attempt index is over-fetched ({@code judge.memory.contrastive-overfetch}
 * times {@code k}) because the success/failure split among the nearest
 * neighbors is unknown. Each partition keeps the index order and is cut at
 * {@code k}. Attempts that were never judged belong to neither partition.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContrastiveRetriever {

    private final SimilarityIndex similarityIndex;
    private final JudgeProperties properties;

    public ContrastiveExamples findContrastive(Embedding query) {
        return findContrastive(query, properties.getMemory().getContrastiveTopK());
    }

    public ContrastiveExamples findContrastive(Embedding query, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        int fetch = SimilarityIndex.overfetchLimit(k, properties.getMemory().getContrastiveOverfetch());
        List<SimilarityMatch> candidates = similarityIndex.query(NodeKind.ATTEMPT, query, fetch);

        List<SimilarityMatch> positive = new ArrayList<>();
        List<SimilarityMatch> negative = new ArrayList<>();
        for (SimilarityMatch candidate : candidates) {
            AttemptOutcome outcome = candidate.entityAs(Attempt.class).getOutcome();
            if (outcome == AttemptOutcome.SUCCESS && positive.size() < k) {
                positive.add(candidate);
            } else if (outcome == AttemptOutcome.FAILURE && negative.size() < k) {
                negative.add(candidate);
            }
        }

        log.debug("[Contrastive] {} candidates -> {} positive, {} negative (k={})",
                candidates.size(), positive.size(), negative.size(), k);
        return ContrastiveExamples.builder()
                .positive(List.copyOf(positive))
                .negative(List.copyOf(negative))
                .build();
    }
}
