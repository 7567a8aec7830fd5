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
 * Root-cause category reached from the issues of a known set of attempts.
 */
@Value
@Builder
public class SemanticHistoryPattern {

    Semantic semantic;

    /** Number of distinct issues abstracting to the category. */
    int issueCount;

    /** First few distinct issue descriptions, in traversal order. */
    @Builder.Default
    List<String> sampleIssues = List.of();
}
