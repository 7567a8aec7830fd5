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
import java.util.Map;

/**
 * Precedent selected for one attempt after the confidence floors were applied.
 */
@Value
@Builder
public class MemoryRetrieval {

    @Builder.Default
    List<SimilarityMatch> positive = List.of();

    @Builder.Default
    List<SimilarityMatch> negative = List.of();

    /** Issues of each failed precedent, keyed by attempt id. */
    @Builder.Default
    Map<String, List<Issue>> failureIssues = Map.of();

    /** Fixes of each listed issue, keyed by issue id. */
    @Builder.Default
    Map<String, List<Fix>> fixesByIssue = Map.of();

    /** Root causes recurring among the failed precedent. */
    @Builder.Default
    List<SemanticHistoryPattern> historyPatterns = List.of();

    /** Root causes of issues similar to the attempt. */
    @Builder.Default
    List<SemanticPattern> patterns = List.of();

    public static MemoryRetrieval empty() {
        return MemoryRetrieval.builder().build();
    }

    public boolean isEmpty() {
        return positive.isEmpty() && negative.isEmpty() && patterns.isEmpty();
    }
}
