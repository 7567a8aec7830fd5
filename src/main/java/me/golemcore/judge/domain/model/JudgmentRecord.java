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
 * Everything a judgment produces, embedded and ready to be recorded in the
 * graph: the task as a policy candidate, the judged attempt and its findings.
 */
@Value
@Builder
public class JudgmentRecord {

    Policy policy;

    Attempt attempt;

    @Builder.Default
    List<Finding> findings = List.of();

    @Builder.Default
    MemoryUsage memoryUsage = MemoryUsage.none();
}
