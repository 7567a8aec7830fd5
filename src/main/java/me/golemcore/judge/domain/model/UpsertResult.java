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
 * Outcome of a reuse-or-create decision.
 *
 * @param id
 *            identifier of the entity now representing the candidate
 * @param created
 *            true if the candidate was persisted, false if an existing node was
 *            reused and the candidate discarded
 */
public record UpsertResult(String id, boolean created) {

    public static UpsertResult created(String id) {
        return new UpsertResult(id, true);
    }

    public static UpsertResult reused(String id) {
        return new UpsertResult(id, false);
    }
}
