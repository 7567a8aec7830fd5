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

/**
 * How much precedent went into a memory-assisted judgment.
 */
@Value
@Builder
public class MemoryUsage {

    boolean used;
    int positiveExamples;
    int negativeExamples;
    int patterns;

    public static MemoryUsage none() {
        return MemoryUsage.builder().used(false).build();
    }

    public static MemoryUsage from(MemoryRetrieval retrieval) {
        return MemoryUsage.builder()
                .used(!retrieval.isEmpty())
                .positiveExamples(retrieval.getPositive().size())
                .negativeExamples(retrieval.getNegative().size())
                .patterns(retrieval.getPatterns().size())
                .build();
    }
}
