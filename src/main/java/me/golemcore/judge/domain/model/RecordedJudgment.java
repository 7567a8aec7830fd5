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
 * Identifiers assigned while a judgment was written to the graph.
 */
@Value
@Builder
public class RecordedJudgment {

    String policyId;

    /** False when the task merged into an existing policy. */
    boolean policyCreated;

    String attemptId;

    @Builder.Default
    List<String> issueIds = List.of();

    @Builder.Default
    List<String> fixIds = List.of();

    /** Semantic linked to each issue, same order as {@link #issueIds}. */
    @Builder.Default
    List<String> semanticIds = List.of();

    int semanticsCreated;
}
