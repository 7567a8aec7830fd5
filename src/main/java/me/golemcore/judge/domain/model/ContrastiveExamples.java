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

import java.util.List;

/**
 * Nearest prior attempts split by outcome. Each side keeps the similarity order
 * of the index and may hold fewer items than requested.
 */
@Value
@Builder
public class ContrastiveExamples {

    @Builder.Default
    List<SimilarityMatch> positive = List.of();

    @Builder.Default
    List<SimilarityMatch> negative = List.of();

    public static ContrastiveExamples empty() {
        return ContrastiveExamples.builder().build();
    }

    public boolean isEmpty() {
        return positive.isEmpty() && negative.isEmpty();
    }
}
