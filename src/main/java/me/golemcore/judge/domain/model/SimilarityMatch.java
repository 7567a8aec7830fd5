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

/**
 * One nearest-neighbor hit: the stored entity and its cosine similarity to the
 * query, in [-1, 1].
 */
public record SimilarityMatch(GraphEntity entity, double score) {

    public String id() {
        return entity.getId();
    }

    public <T extends GraphEntity> T entityAs(Class<T> type) {
        return type.cast(entity);
    }
}
